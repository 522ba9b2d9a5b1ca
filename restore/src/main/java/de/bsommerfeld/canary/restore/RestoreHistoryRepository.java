package de.bsommerfeld.canary.restore;

import com.google.inject.Inject;
import de.bsommerfeld.canary.db.SqlLoader;
import de.bsommerfeld.canary.db.Transactor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only access to {@code restore_history}. The table is created on
 * first use, since a restored database may predate the migration that adds
 * it.
 */
public class RestoreHistoryRepository {

    private final Transactor transactor;

    @Inject
    public RestoreHistoryRepository(Transactor transactor) {
        this.transactor = transactor;
    }

    /** Appends {@code operation} and returns it with its generated id. */
    public RestoreOperation append(RestoreOperation operation) {
        return transactor.inTransaction(conn -> {
            ensureTable(conn);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-restore-history"),
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, operation.timestamp());
                ps.setString(2, operation.backupFile());
                ps.setString(3, operation.restoreType());
                ps.setString(4, operation.safetyBackup());
                ps.setString(5, operation.status().label());
                ps.setString(6, operation.notes());
                ps.executeUpdate();
                long id = -1;
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (keys.next()) {
                        id = keys.getLong(1);
                    }
                }
                return new RestoreOperation(id, operation.timestamp(), operation.backupFile(),
                        operation.restoreType(), operation.safetyBackup(), operation.status(), operation.notes());
            }
        });
    }

    /** Most recent attempts first. */
    public List<RestoreOperation> recent(int limit) {
        return transactor.withConnection(conn -> {
            ensureTable(conn);
            List<RestoreOperation> operations = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-restore-history"))) {
                ps.setInt(1, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        operations.add(new RestoreOperation(
                                rs.getLong("id"),
                                rs.getString("timestamp"),
                                rs.getString("backup_file"),
                                rs.getString("restore_type"),
                                rs.getString("safety_backup"),
                                RestoreStatus.fromLabel(rs.getString("status")),
                                rs.getString("notes")));
                    }
                }
            }
            return operations;
        });
    }

    private static void ensureTable(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(SqlLoader.load("create-restore-history"));
        }
    }
}
