package de.bsommerfeld.canary.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Advisory single-writer lock for the live database file.
 *
 * <p>
 * SQLite allows one writer at a time, and the archival write-then-delete
 * sequence must not interleave with restores or migrations. The lock has two
 * layers:
 * <ul>
 * <li>a {@link ReentrantLock} serializing threads of this JVM (a
 * {@link FileLock} is held per process, so it cannot do that alone)</li>
 * <li>an OS file lock on {@code <database>.lock} excluding other processes
 * such as a concurrently running collector or a second CLI invocation</li>
 * </ul>
 * The lock is reentrant for the owning thread: nested acquisitions (e.g. a
 * full-system restore that replaces the database) only take the file lock
 * once.
 */
public final class DatabaseLock {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseLock.class);

    private final Path lockFile;
    private final long timeoutMillis;
    private final ReentrantLock processLock = new ReentrantLock();

    private FileChannel channel;
    private FileLock fileLock;

    public DatabaseLock(Path databaseFile) {
        this(databaseFile, TimeUnit.SECONDS.toMillis(30));
    }

    public DatabaseLock(Path databaseFile, long timeoutMillis) {
        this.lockFile = databaseFile.resolveSibling(databaseFile.getFileName() + ".lock");
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Blocks until the lock is held or the timeout elapses.
     *
     * @param purpose short description used in log and error messages
     * @return a handle that releases the lock when closed
     * @throws IOException if the lock cannot be obtained in time
     */
    public Handle acquire(String purpose) throws IOException {
        try {
            if (!processLock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new IOException("Timed out waiting for database lock (" + purpose + ")");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for database lock (" + purpose + ")", e);
        }

        if (processLock.getHoldCount() > 1) {
            return new Handle(purpose);
        }

        try {
            acquireFileLock(purpose);
        } catch (IOException | RuntimeException e) {
            processLock.unlock();
            throw e;
        }
        LOG.debug("[LOCK] Acquired {} for {}", lockFile.getFileName(), purpose);
        return new Handle(purpose);
    }

    private void acquireFileLock(String purpose) throws IOException {
        Path parent = lockFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel ch = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        long deadline = System.currentTimeMillis() + timeoutMillis;
        try {
            FileLock lock;
            while ((lock = ch.tryLock()) == null) {
                if (System.currentTimeMillis() >= deadline) {
                    throw new IOException("Database is locked by another process (" + purpose + ")");
                }
                Thread.sleep(100);
            }
            this.channel = ch;
            this.fileLock = lock;
        } catch (InterruptedException e) {
            ch.close();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for database lock (" + purpose + ")", e);
        } catch (IOException | RuntimeException e) {
            ch.close();
            throw e;
        }
    }

    private void release(String purpose) {
        try {
            if (processLock.getHoldCount() == 1) {
                try {
                    fileLock.release();
                    channel.close();
                    LOG.debug("[LOCK] Released {} after {}", lockFile.getFileName(), purpose);
                } catch (IOException e) {
                    LOG.warn("[LOCK] Failed to release {} cleanly", lockFile, e);
                } finally {
                    fileLock = null;
                    channel = null;
                }
            }
        } finally {
            processLock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return processLock.isHeldByCurrentThread();
    }

    /** Scoped ownership of the lock; use with try-with-resources. */
    public final class Handle implements AutoCloseable {

        private final String purpose;
        private boolean closed;

        private Handle(String purpose) {
            this.purpose = purpose;
        }

        @Override
        public void close() {
            if (closed)
                return;
            closed = true;
            release(purpose);
        }
    }
}
