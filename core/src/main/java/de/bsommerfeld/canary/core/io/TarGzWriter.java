package de.bsommerfeld.canary.core.io;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes a {@code .tar.gz} bundle durably.
 *
 * <p>
 * Entries are streamed into a {@code .tmp} sibling of the target. Only
 * {@link #commit()} flushes the gzip trailer, forces the bytes to disk and
 * publishes the file under its final name, refusing to replace an existing
 * file; a writer closed without a commit
 * deletes its temporary file, so a crash or failure never leaves a truncated
 * bundle under the final name.
 *
 * <pre>
 * try (TarGzWriter tar = TarGzWriter.open(target)) {
 *     tar.addFile(db, "bundle/data/canary_protocol.db");
 *     tar.commit();
 * }
 * </pre>
 */
public final class TarGzWriter implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(TarGzWriter.class);

    private final Path target;
    private final Path tmp;
    private final TarArchiveOutputStream tarOut;
    private int entries;
    private boolean committed;
    private boolean closed;

    private TarGzWriter(Path target) throws IOException {
        this.target = target;
        this.tmp = DurableFiles.tmpOf(target);
        Files.createDirectories(target.toAbsolutePath().getParent());
        this.tarOut = new TarArchiveOutputStream(
                new GzipCompressorOutputStream(new SyncingOutputStream(new FileOutputStream(tmp.toFile()))));
        this.tarOut.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        this.tarOut.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
    }

    public static TarGzWriter open(Path target) throws IOException {
        return new TarGzWriter(target);
    }

    /** Adds a regular file under the given entry name. */
    public void addFile(Path file, String entryName) throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(file.toFile(), entryName);
        tarOut.putArchiveEntry(entry);
        try (InputStream in = Files.newInputStream(file)) {
            in.transferTo(tarOut);
        }
        tarOut.closeArchiveEntry();
        entries++;
    }

    /** Adds an empty directory entry; {@code entryName} gets a trailing slash. */
    public void addDirectory(String entryName) throws IOException {
        String name = entryName.endsWith("/") ? entryName : entryName + "/";
        tarOut.putArchiveEntry(new TarArchiveEntry(name));
        tarOut.closeArchiveEntry();
    }

    /**
     * Adds every regular file below {@code directory}, preserving relative
     * paths under {@code prefix}. A missing directory contributes only the
     * directory entry itself.
     *
     * @return number of files added
     */
    public int addTree(Path directory, String prefix) throws IOException {
        addDirectory(prefix);
        if (!Files.isDirectory(directory))
            return 0;

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        String base = prefix.endsWith("/") ? prefix : prefix + "/";
        for (Path file : files) {
            String relative = directory.relativize(file).toString().replace('\\', '/');
            addFile(file, base + relative);
        }
        return files.size();
    }

    /** Adds a UTF-8 text file generated in memory. */
    public void addText(String entryName, String content) throws IOException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        TarArchiveEntry entry = new TarArchiveEntry(entryName);
        entry.setSize(bytes.length);
        tarOut.putArchiveEntry(entry);
        tarOut.write(bytes);
        tarOut.closeArchiveEntry();
        entries++;
    }

    public int entryCount() {
        return entries;
    }

    /**
     * Finishes the archive, fsyncs it and moves it to the target name.
     *
     * @return the final path
     */
    public Path commit() throws IOException {
        tarOut.finish();
        tarOut.close();
        closed = true;
        DurableFiles.publish(tmp, target);
        committed = true;
        LOG.debug("[TAR] Wrote {} ({} entries)", target.getFileName(), entries);
        return target;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            tarOut.close();
        }
        if (!committed) {
            Files.deleteIfExists(tmp);
        }
    }
}
