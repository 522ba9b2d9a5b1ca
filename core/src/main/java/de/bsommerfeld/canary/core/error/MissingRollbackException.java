package de.bsommerfeld.canary.core.error;

/**
 * Thrown when a rollback is requested for a migration without down statements.
 */
public class MissingRollbackException extends MigrationException {

    public MissingRollbackException(String version) {
        super(version, "Migration " + version + " has no rollback statements");
    }
}
