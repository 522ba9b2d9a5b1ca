package de.bsommerfeld.canary.db.migration;

import java.util.List;

/**
 * Snapshot of the migration state of the live database.
 *
 * @param drifted versions whose applied checksum differs from the current
 *                definition
 */
public record MigrationStatus(
        String currentVersion,
        List<String> applied,
        List<String> pending,
        List<String> drifted) {

    public MigrationStatus {
        applied = List.copyOf(applied);
        pending = List.copyOf(pending);
        drifted = List.copyOf(drifted);
    }

    public int appliedCount() {
        return applied.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean upToDate() {
        return pending.isEmpty();
    }
}
