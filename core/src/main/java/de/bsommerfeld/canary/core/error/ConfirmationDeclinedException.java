package de.bsommerfeld.canary.core.error;

/**
 * Thrown when the operator declines a destructive action.
 */
public class ConfirmationDeclinedException extends LifecycleException {

    public ConfirmationDeclinedException(String message) {
        super(message);
    }
}
