package de.bsommerfeld.canary.cli;

/** Malformed command line; reported with exit code 2. */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }
}
