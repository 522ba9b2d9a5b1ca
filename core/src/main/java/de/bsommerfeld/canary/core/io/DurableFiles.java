package de.bsommerfeld.canary.core.io;

import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Write-to-temp, fsync, publish. A file written through these methods is
 * either absent or complete under its final name, and an existing file is
 * never replaced: publishing onto a taken name fails with
 * {@link FileAlreadyExistsException} and leaves the existing file intact.
 */
public final class DurableFiles {

    /** Streams content into the given output. */
    @FunctionalInterface
    public interface Content {
        void writeTo(OutputStream out) throws IOException;
    }

    private DurableFiles() {
    }

    public static Path write(Path target, Content content) throws IOException {
        return write(target, content, false);
    }

    /** Like {@link #write}, gzip-compressing the content. */
    public static Path writeGzip(Path target, Content content) throws IOException {
        return write(target, content, true);
    }

    /**
     * First free name of {@code <stem><extension>}, {@code <stem>_1<extension>},
     * {@code <stem>_2<extension>}, ... in {@code directory}. Names are
     * timestamped to the second, so two runs within one second get distinct
     * files instead of sharing one.
     */
    public static Path unusedName(Path directory, String stem, String extension) {
        Path candidate = directory.resolve(stem + extension);
        for (int n = 1; Files.exists(candidate) || Files.exists(tmpOf(candidate)); n++) {
            candidate = directory.resolve(stem + "_" + n + extension);
        }
        return candidate;
    }

    /**
     * Moves a fully written and synced {@code tmp} to {@code target} without
     * ever replacing an existing {@code target}.
     *
     * @throws FileAlreadyExistsException if {@code target} exists
     */
    public static void publish(Path tmp, Path target) throws IOException {
        try {
            Files.createLink(target, tmp);
        } catch (UnsupportedOperationException e) {
            // no hard links on this file system; a plain move still refuses to replace
            Files.move(tmp, target);
            return;
        }
        Files.delete(tmp);
    }

    static Path tmpOf(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }

    private static Path write(Path target, Content content, boolean gzip) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        Path tmp = tmpOf(target);
        try {
            OutputStream raw = new SyncingOutputStream(new FileOutputStream(tmp.toFile()));
            try (OutputStream out = gzip ? new GzipCompressorOutputStream(raw) : raw) {
                content.writeTo(out);
            }
            publish(tmp, target);
            return target;
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
