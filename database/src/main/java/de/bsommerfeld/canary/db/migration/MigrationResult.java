package de.bsommerfeld.canary.db.migration;

import java.util.List;

/** Outcome of {@link SchemaMigrationEngine#applyPending(String)}. */
public record MigrationResult(int appliedCount, List<String> appliedVersions, String currentVersion) {

    public MigrationResult {
        appliedVersions = List.copyOf(appliedVersions);
    }
}
