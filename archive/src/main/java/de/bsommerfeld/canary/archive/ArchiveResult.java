package de.bsommerfeld.canary.archive;

import java.nio.file.Path;

/**
 * Outcome of archiving one table or the log directory.
 *
 * @param item        table name, or {@code logs}
 * @param archiveFile {@code null} when there was nothing to archive
 */
public record ArchiveResult(String item, int archivedCount, Path archiveFile, String cutoff) {

    static ArchiveResult nothing(String item, String cutoff) {
        return new ArchiveResult(item, 0, null, cutoff);
    }

    public boolean archivedAnything() {
        return archivedCount > 0;
    }
}
