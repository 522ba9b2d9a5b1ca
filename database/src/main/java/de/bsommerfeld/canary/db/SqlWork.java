package de.bsommerfeld.canary.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of work executed against an open connection. The type parameter
 * {@code X} lets callers throw their own checked exception (for example an
 * {@link java.io.IOException} while an archive file is written inside the
 * transaction) without wrapping it.
 */
@FunctionalInterface
public interface SqlWork<T, X extends Exception> {

    T run(Connection connection) throws SQLException, X;
}
