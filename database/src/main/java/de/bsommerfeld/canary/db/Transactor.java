package de.bsommerfeld.canary.db;

/**
 * Runs units of work against the live database.
 *
 * <p>
 * {@link java.sql.SQLException}s raised by the work or by the commit are
 * translated into the unchecked
 * {@link de.bsommerfeld.canary.core.error.DataAccessException}; any other
 * checked exception declared by the work propagates unchanged after the
 * transaction has been rolled back.
 */
public interface Transactor {

    /**
     * Executes {@code work} in a single transaction. The transaction is
     * committed if the work returns normally and rolled back otherwise.
     */
    <T, X extends Exception> T inTransaction(SqlWork<T, X> work) throws X;

    /** Executes {@code work} on an auto-commit connection. */
    <T, X extends Exception> T withConnection(SqlWork<T, X> work) throws X;
}
