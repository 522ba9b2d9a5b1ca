package de.bsommerfeld.canary.restore;

/**
 * Asks a human before a destructive restore. Implementations block until
 * the operator answered.
 */
@FunctionalInterface
public interface ConfirmationPrompt {

    /** @return {@code true} only on explicit approval */
    boolean confirm(String question);
}
