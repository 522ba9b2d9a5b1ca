package de.bsommerfeld.canary.core.event;

import java.nio.file.Path;

/**
 * Events emitted by the lifecycle components. Each event describes one
 * finished unit of work; aggregate results are still returned from the
 * operations themselves.
 */
public final class LifecycleEvents {

    private LifecycleEvents() {
    }

    public record MigrationAppliedEvent(String version, String description) {
    }

    public record MigrationRolledBackEvent(String version) {
    }

    /**
     * Fired for every backup of a batch verification run.
     *
     * @param status PASS, FAIL or ERROR
     */
    public record BackupVerifiedEvent(Path backupFile, String status, int errorCount) {
    }

    /**
     * Fired per table or log bundle of an archival run.
     *
     * @param item     table name, or {@code logs}
     * @param archived number of rows or files moved into the archive
     * @param error    failure message, {@code null} on success
     */
    public record ArchiveItemCompletedEvent(String item, int archived, Path archiveFile, String error) {
    }

    public record RestoreCompletedEvent(Path backupFile, String restoreType, String status) {
    }
}
