package de.bsommerfeld.canary.core.error;

import java.util.List;

/**
 * Thrown when a migration or rollback cannot be applied. The failing unit is
 * always rolled back; {@link #getAppliedBeforeFailure()} lists the versions of
 * the same batch that committed before the failure.
 */
public class MigrationException extends LifecycleException {

    private final String version;
    private final List<String> appliedBeforeFailure;

    public MigrationException(String version, String message) {
        this(version, message, List.of(), null);
    }

    public MigrationException(String version, String message, List<String> appliedBeforeFailure, Throwable cause) {
        super(message, cause);
        this.version = version;
        this.appliedBeforeFailure = List.copyOf(appliedBeforeFailure);
    }

    public String getVersion() {
        return version;
    }

    public List<String> getAppliedBeforeFailure() {
        return appliedBeforeFailure;
    }
}
