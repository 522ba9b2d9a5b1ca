package de.bsommerfeld.canary.db;

import de.bsommerfeld.canary.core.error.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * {@link Transactor} over a {@link ConnectionFactory}, one connection per
 * call.
 */
public class SqliteTransactor implements Transactor {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteTransactor.class);

    private final ConnectionFactory connections;

    public SqliteTransactor(ConnectionFactory connections) {
        this.connections = connections;
    }

    @Override
    public <T, X extends Exception> T inTransaction(SqlWork<T, X> work) throws X {
        try (Connection conn = connections.open()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (Throwable t) {
                rollback(conn, t);
                throw t;
            }
        } catch (SQLException e) {
            throw new DataAccessException("[DB] Transaction failed on " + connections.databaseFile(), e);
        }
    }

    @Override
    public <T, X extends Exception> T withConnection(SqlWork<T, X> work) throws X {
        try (Connection conn = connections.open()) {
            return work.run(conn);
        } catch (SQLException e) {
            throw new DataAccessException("[DB] Query failed on " + connections.databaseFile(), e);
        }
    }

    private static void rollback(Connection conn, Throwable cause) {
        try {
            conn.rollback();
            LOG.debug("[DB] Rolled back transaction after {}", cause.toString());
        } catch (SQLException e) {
            LOG.error("[DB] Rollback failed", e);
            cause.addSuppressed(e);
        }
    }
}
