package de.bsommerfeld.canary.db.migration;

/**
 * A row of {@code schema_migrations}.
 *
 * @param checksum {@code null} for rows written before checksums were tracked
 */
public record AppliedMigration(String version, String description, String appliedAt, String checksum) {
}
