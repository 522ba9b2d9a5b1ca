package de.bsommerfeld.canary.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the user-visible schema of a SQLite database. Internal
 * {@code sqlite_*} tables are never reported.
 */
public final class SchemaInspector {

    private SchemaInspector() {
    }

    /** All user tables by name, in name order, with columns and row counts. */
    public static Map<String, TableInfo> inspect(Connection conn) throws SQLException {
        Map<String, TableInfo> tables = new LinkedHashMap<>();
        for (String table : listTables(conn)) {
            tables.put(table, new TableInfo(table, columns(conn, table), rowCount(conn, table)));
        }
        return tables;
    }

    public static List<String> listTables(Connection conn) throws SQLException {
        List<String> names = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("select-user-tables"))) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    public static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-table-exists"))) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /** Table metadata without the row count, or empty if the table is absent. */
    public static Optional<TableInfo> describe(Connection conn, String table) throws SQLException {
        if (!tableExists(conn, table))
            return Optional.empty();
        return Optional.of(new TableInfo(table, columns(conn, table), -1));
    }

    public static List<ColumnInfo> columns(Connection conn, String table) throws SQLException {
        List<ColumnInfo> columns = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + quote(table) + ")")) {
            while (rs.next()) {
                columns.add(new ColumnInfo(
                        rs.getString("name"),
                        rs.getString("type"),
                        rs.getInt("notnull") == 1,
                        rs.getInt("pk")));
            }
        }
        return columns;
    }

    public static long rowCount(Connection conn, String table) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + quote(table))) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    /** Quotes an SQL identifier, doubling embedded quote characters. */
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
