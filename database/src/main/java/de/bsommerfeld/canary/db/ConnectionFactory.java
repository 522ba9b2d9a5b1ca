package de.bsommerfeld.canary.db;

import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens JDBC connections to SQLite database files.
 *
 * <p>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level, so pooling provides no
 * benefit for a batch-style subsystem that runs a handful of transactions per
 * invocation.
 *
 * <p>
 * Backups are always opened through {@link #openReadOnly(Path)}: verifying
 * a backup must never create, migrate or otherwise touch the file.
 */
public class ConnectionFactory {

    private static final int BUSY_TIMEOUT_MILLIS = 5000;

    private final Path databaseFile;

    public ConnectionFactory(Path databaseFile) {
        this.databaseFile = databaseFile;
    }

    public Path databaseFile() {
        return databaseFile;
    }

    /**
     * Opens a read-write connection to the live database, creating the parent
     * directory (and, through SQLite, the file) if necessary.
     */
    public Connection open() throws SQLException {
        Path parent = databaseFile.toAbsolutePath().getParent();
        try {
            if (parent != null)
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SQLException("Cannot create database directory " + parent, e);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        return DriverManager.getConnection(url(databaseFile), config.toProperties());
    }

    /**
     * Opens an existing database file without write access. Fails if the
     * file does not exist.
     */
    public static Connection openReadOnly(Path file) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        return DriverManager.getConnection(url(file), config.toProperties());
    }

    public static String url(Path file) {
        return "jdbc:sqlite:" + file.toAbsolutePath();
    }
}
