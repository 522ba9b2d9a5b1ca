package de.bsommerfeld.canary.archive;

import java.nio.file.Path;

/**
 * Outcome of re-inserting an archived table snapshot.
 *
 * @param skipped rows whose primary key already exists in the live table
 */
public record ArchiveRestoreResult(Path archiveFile, String table, int restored, int skipped) {
}
