package de.bsommerfeld.canary.core.error;

/**
 * Unchecked translation of a storage-level failure (for JDBC: a
 * {@link java.sql.SQLException}). Raised by the transactional helpers so that
 * callbacks do not have to declare driver exceptions.
 */
public class DataAccessException extends RuntimeException {

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
