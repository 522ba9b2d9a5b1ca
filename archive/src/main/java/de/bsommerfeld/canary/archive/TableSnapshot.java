package de.bsommerfeld.canary.archive;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content of a {@code <table>_<ts>.json.gz} archive: the archived rows exactly
 * as they were stored, plus the metadata needed to put them back.
 *
 * @param primaryKey  key columns used to detect rows that already exist;
 *                    {@code ["rowid"]} for tables without a declared key
 * @param columnTypes declared SQLite type per column, in table order
 * @param records     one map per row, column name to stored value
 */
public record TableSnapshot(
        String table,
        String dateColumn,
        int retentionDays,
        String cutoff,
        String archivedAt,
        int recordCount,
        List<String> primaryKey,
        Map<String, String> columnTypes,
        List<Map<String, Object>> records) {

    public TableSnapshot {
        primaryKey = List.copyOf(primaryKey);
        columnTypes = new LinkedHashMap<>(columnTypes);
        records = List.copyOf(records);
    }

    public boolean keyedByRowid() {
        return primaryKey.equals(List.of(DataArchivalManager.ROWID));
    }
}
