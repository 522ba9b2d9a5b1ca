package de.bsommerfeld.canary.core.error;

import java.util.List;

/**
 * Thrown when a checksum, schema or data-sample check rejects an artifact
 * that an operation depends on.
 */
public class IntegrityFailureException extends LifecycleException {

    private final List<String> problems;

    public IntegrityFailureException(String message, List<String> problems) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
