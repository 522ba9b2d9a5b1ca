package de.bsommerfeld.canary.core.error;

/**
 * Thrown when a restore fails while copying, extracting or validating data.
 * Live state is never partially overwritten when this is raised before the
 * final replacement step.
 */
public class RestoreException extends LifecycleException {

    public RestoreException(String message) {
        super(message);
    }

    public RestoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
