package de.bsommerfeld.canary.archive;

import de.bsommerfeld.canary.core.config.ArchivalConfig;

/** How long rows of a table stay in the live database. */
public record RetentionPolicy(String table, String dateColumn, int retentionDays) {

    public RetentionPolicy {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("Retention for " + table + " must be at least one day");
        }
    }

    static RetentionPolicy from(ArchivalConfig.TablePolicy policy) {
        return new RetentionPolicy(policy.getTable(), policy.getDateColumn(), policy.getRetentionDays());
    }
}
