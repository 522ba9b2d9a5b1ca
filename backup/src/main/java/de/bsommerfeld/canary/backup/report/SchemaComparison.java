package de.bsommerfeld.canary.backup.report;

/** Table counts of the live database versus a backup. */
public record SchemaComparison(int liveTables, int backupTables, int matchingTables) {
}
