package de.bsommerfeld.canary.core.io;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code .tar.gz} bundles.
 *
 * <p>
 * Extraction is confined to the destination directory: entries with absolute
 * names, names that resolve outside the destination after normalization, and
 * symbolic or hard links are rejected with an {@link UnsafeEntryException}
 * before anything outside the destination is touched.
 */
public final class TarGzReader {

    private static final Logger LOG = LoggerFactory.getLogger(TarGzReader.class);

    private TarGzReader() {
    }

    /** Thrown for entries that would escape the extraction directory. */
    public static class UnsafeEntryException extends IOException {

        private final String entryName;

        public UnsafeEntryException(String entryName, String reason) {
            super("Unsafe archive entry '" + entryName + "': " + reason);
            this.entryName = entryName;
        }

        public String getEntryName() {
            return entryName;
        }
    }

    /**
     * Extracts every entry into {@code destination}.
     *
     * @return the regular files written, in archive order
     * @throws UnsafeEntryException if an entry would escape
     *                              {@code destination}
     */
    public static List<Path> extract(Path archive, Path destination) throws IOException {
        Path root = destination.toAbsolutePath().normalize();
        Files.createDirectories(root);
        List<Path> written = new ArrayList<>();

        try (TarArchiveInputStream tar = open(archive)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                Path target = resolveSafely(root, entry);
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                written.add(target);
            }
        }
        LOG.debug("[TAR] Extracted {} files from {}", written.size(), archive.getFileName());
        return written;
    }

    /** Lists entry names without extracting. */
    public static List<String> entryNames(Path archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (TarArchiveInputStream tar = open(archive)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }

    private static TarArchiveInputStream open(Path archive) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(archive));
        try {
            return new TarArchiveInputStream(new GzipCompressorInputStream(in));
        } catch (IOException e) {
            in.close();
            throw e;
        }
    }

    static Path resolveSafely(Path root, TarArchiveEntry entry) throws UnsafeEntryException {
        String name = entry.getName().replace('\\', '/');
        if (entry.isSymbolicLink() || entry.isLink()) {
            throw new UnsafeEntryException(name, "links are not allowed");
        }
        if (name.startsWith("/") || name.matches("^[A-Za-z]:.*")) {
            throw new UnsafeEntryException(name, "absolute path");
        }
        Path target = root.resolve(name).normalize();
        if (!target.startsWith(root)) {
            throw new UnsafeEntryException(name, "path traversal");
        }
        return target;
    }
}
