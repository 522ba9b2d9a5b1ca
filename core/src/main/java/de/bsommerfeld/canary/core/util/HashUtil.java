package de.bsommerfeld.canary.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * SHA-256 hashing utility. Uses streaming I/O so multi-gigabyte backups never
 * have to fit into memory.
 */
public final class HashUtil {

    private static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 8192;

    private HashUtil() {
    }

    /**
     * Computes the hex-encoded SHA-256 hash of the given file.
     *
     * @throws IOException if the file cannot be read
     */
    public static String sha256(Path file) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Computes a hash over an ordered list of statements. Each statement is
     * terminated by a NUL byte so that {@code ["ab", "c"]} and
     * {@code ["a", "bc"]} hash differently.
     */
    public static String sha256(List<String> statements) {
        MessageDigest digest = newDigest();
        for (String statement : statements) {
            digest.update(statement.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Reads the hash from a {@code sha256sum}-style sidecar file
     * ({@code <hash>  <filename>}). Returns {@code null} if the file is empty.
     */
    public static String readSidecar(Path sidecar) throws IOException {
        String content = Files.readString(sidecar, StandardCharsets.UTF_8).strip();
        if (content.isEmpty())
            return null;
        return content.split("\\s+")[0].toLowerCase();
    }

    /** Writes a {@code sha256sum}-compatible sidecar next to {@code file}. */
    public static Path writeSidecar(Path file) throws IOException {
        Path sidecar = sidecarOf(file);
        Files.writeString(sidecar, sha256(file) + "  " + file.getFileName() + System.lineSeparator(),
                StandardCharsets.UTF_8);
        return sidecar;
    }

    public static Path sidecarOf(Path file) {
        String name = file.getFileName().toString();
        String stem = name.endsWith(".tar.gz") ? name.substring(0, name.length() - ".tar.gz".length()) : name;
        return file.resolveSibling(stem + ".sha256");
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandated by the JVM spec
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
