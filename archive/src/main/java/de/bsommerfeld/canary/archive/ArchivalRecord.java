package de.bsommerfeld.canary.archive;

/**
 * A row of the append-only {@code archive_history} audit table.
 *
 * @param cutoff    UTC cutoff in SQLite {@code datetime()} format
 * @param createdAt UTC time the archive was committed
 */
public record ArchivalRecord(
        long id,
        String tableName,
        String dateColumn,
        int retentionDays,
        String cutoff,
        int archivedCount,
        String archiveFile,
        String createdAt) {
}
