package de.bsommerfeld.canary.archive;

import java.time.Instant;
import java.util.Map;

/**
 * Inventory of the archive directory.
 *
 * @param byType counts and sizes keyed by {@link ArchiveKind}
 * @param oldest modification time of the oldest archive, {@code null} if empty
 */
public record ArchiveSummary(
        Map<ArchiveKind, KindTotals> byType,
        int totalFiles,
        long totalBytes,
        double totalSizeMb,
        Instant oldest,
        Instant newest) {

    public ArchiveSummary {
        byType = Map.copyOf(byType);
    }

    public record KindTotals(int files, long bytes) {
    }
}
