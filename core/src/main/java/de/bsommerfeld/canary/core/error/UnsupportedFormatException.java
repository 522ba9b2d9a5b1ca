package de.bsommerfeld.canary.core.error;

/**
 * Thrown when a backup or archive file has a type the operation cannot handle.
 */
public class UnsupportedFormatException extends LifecycleException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
