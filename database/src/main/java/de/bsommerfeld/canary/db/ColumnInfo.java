package de.bsommerfeld.canary.db;

/**
 * One column as reported by {@code PRAGMA table_info}.
 *
 * @param primaryKey 1-based position in the primary key, 0 if not part of it
 */
public record ColumnInfo(String name, String type, boolean notNull, int primaryKey) {
}
