package de.bsommerfeld.canary.db;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/** Columns and row count of a single user table. */
public record TableInfo(String name, List<ColumnInfo> columns, long rowCount) {

    public TableInfo {
        columns = List.copyOf(columns);
    }

    /** Primary key column names in key order; empty for rowid-only tables. */
    public List<String> primaryKey() {
        return columns.stream()
                .filter(c -> c.primaryKey() > 0)
                .sorted(Comparator.comparingInt(ColumnInfo::primaryKey))
                .map(ColumnInfo::name)
                .collect(Collectors.toList());
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnInfo::name).collect(Collectors.toList());
    }

    public boolean hasColumn(String column) {
        return columns.stream().anyMatch(c -> c.name().equalsIgnoreCase(column));
    }
}
