package de.bsommerfeld.canary.archive;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of a full archival run, persisted as
 * {@code archival_report_<yyyyMMdd_HHmmss>.json}.
 */
public record ArchivalReport(
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        List<Item> items,
        int totalArchived,
        int failedItems,
        boolean cancelled) {

    public ArchivalReport {
        items = List.copyOf(items);
    }

    /**
     * @param error failure message; {@code null} if the item succeeded
     */
    public record Item(String item, int archived, String archiveFile, String cutoff, String error) {
    }
}
