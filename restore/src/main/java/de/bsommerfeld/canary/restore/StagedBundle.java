package de.bsommerfeld.canary.restore;

import de.bsommerfeld.canary.core.error.RestoreException;
import de.bsommerfeld.canary.core.io.TarGzReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A full-system bundle extracted into a private temporary directory. Closing
 * it removes the directory.
 *
 * <p>
 * The bundle root is either the archive root or its single top-level
 * directory (as written by the backup creator, {@code canary_backup_<ts>/}).
 * Either way it must contain {@code data/<database file>}.
 */
final class StagedBundle implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StagedBundle.class);

    private final Path tempDir;
    private final Path root;
    private final Path databaseFile;

    private StagedBundle(Path tempDir, Path root, Path databaseFile) {
        this.tempDir = tempDir;
        this.root = root;
        this.databaseFile = databaseFile;
    }

    /**
     * Extracts {@code bundle} and validates its layout. The temporary
     * directory is already removed when this throws.
     *
     * @throws RestoreException if an entry escapes the staging directory or
     *                          the database file is missing
     */
    static StagedBundle extract(Path bundle, String databaseName) throws RestoreException, IOException {
        Path tempDir = Files.createTempDirectory("canary_restore_");
        try {
            List<Path> files = TarGzReader.extract(bundle, tempDir);
            LOG.info("[RESTORE] Staged {} files from {}", files.size(), bundle.getFileName());
            Path root = locateRoot(tempDir, databaseName);
            return new StagedBundle(tempDir, root, root.resolve("data").resolve(databaseName));
        } catch (TarGzReader.UnsafeEntryException e) {
            deleteQuietly(tempDir, e);
            throw new RestoreException("Bundle rejected: " + e.getMessage(), e);
        } catch (RestoreException | IOException | RuntimeException e) {
            deleteQuietly(tempDir, e);
            throw e;
        }
    }

    private static Path locateRoot(Path tempDir, String databaseName) throws RestoreException, IOException {
        if (Files.isRegularFile(tempDir.resolve("data").resolve(databaseName))) {
            return tempDir;
        }
        List<Path> topLevel;
        try (Stream<Path> children = Files.list(tempDir)) {
            topLevel = children.collect(Collectors.toList());
        }
        if (topLevel.size() == 1 && Files.isDirectory(topLevel.get(0))
                && Files.isRegularFile(topLevel.get(0).resolve("data").resolve(databaseName))) {
            return topLevel.get(0);
        }
        throw new RestoreException("Bundle does not contain data/" + databaseName);
    }

    Path databaseFile() {
        return databaseFile;
    }

    /** A top-level directory of the bundle, or empty if the bundle has none. */
    Optional<Path> subtree(String name) {
        Path dir = root.resolve(name);
        return Files.isDirectory(dir) ? Optional.of(dir) : Optional.empty();
    }

    @Override
    public void close() throws IOException {
        deleteTree(tempDir);
        LOG.debug("[RESTORE] Removed staging directory {}", tempDir);
    }

    private static void deleteQuietly(Path dir, Exception cause) {
        try {
            deleteTree(dir);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    static void deleteTree(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
