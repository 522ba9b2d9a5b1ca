package de.bsommerfeld.canary.archive;

/**
 * Dry-run figure for one table.
 *
 * @param error reason the table could not be evaluated, {@code null} otherwise
 */
public record CandidateCount(String table, String dateColumn, int retentionDays, String cutoff, long candidates,
        String error) {
}
