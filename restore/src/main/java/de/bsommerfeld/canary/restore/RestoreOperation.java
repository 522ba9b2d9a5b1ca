package de.bsommerfeld.canary.restore;

/**
 * One row of the {@code restore_history} audit table. Every restore attempt
 * appends exactly one.
 *
 * @param restoreType  {@code database}, {@code full_system}, or the inferred
 *                     type of a backup that could not be restored
 * @param safetyBackup copy of the replaced database; {@code null} if there
 *                     was none to replace or the attempt stopped earlier
 */
public record RestoreOperation(
        long id,
        String timestamp,
        String backupFile,
        String restoreType,
        String safetyBackup,
        RestoreStatus status,
        String notes) {

    public boolean succeeded() {
        return status == RestoreStatus.SUCCESS;
    }
}
