package de.bsommerfeld.canary.core.error;

/**
 * Thrown when a backup, archive, migration or version does not exist.
 */
public class NotFoundException extends LifecycleException {

    public NotFoundException(String message) {
        super(message);
    }
}
