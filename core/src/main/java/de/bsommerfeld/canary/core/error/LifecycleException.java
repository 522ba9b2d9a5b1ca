package de.bsommerfeld.canary.core.error;

/**
 * Base of all expected failures raised by the lifecycle components. Callers
 * that only need to report a failure can catch this type; callers that react
 * differently per condition catch the concrete subclasses.
 */
public class LifecycleException extends Exception {

    public LifecycleException(String message) {
        super(message);
    }

    public LifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
