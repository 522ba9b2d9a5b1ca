package de.bsommerfeld.canary.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashUtilTest {

    private static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    @TempDir
    Path tempDir;

    @Test
    void sha256File_shouldMatchKnownValue() throws IOException {
        Path file = tempDir.resolve("empty.db");
        Files.writeString(file, "");

        assertEquals(EMPTY_SHA256, HashUtil.sha256(file));
    }

    @Test
    void sha256File_shouldDifferForDifferentContent() throws IOException {
        Path a = tempDir.resolve("a.db");
        Path b = tempDir.resolve("b.db");
        Files.writeString(a, "content A");
        Files.writeString(b, "content B");

        assertNotEquals(HashUtil.sha256(a), HashUtil.sha256(b));
    }

    @Test
    void sha256File_shouldThrowForNonexistentFile() {
        assertThrows(IOException.class, () -> HashUtil.sha256(tempDir.resolve("ghost.db")));
    }

    @Test
    void sha256Statements_shouldSeparateStatementBoundaries() {
        assertNotEquals(HashUtil.sha256(List.of("ab", "c")), HashUtil.sha256(List.of("a", "bc")));
        assertEquals(HashUtil.sha256(List.of("CREATE TABLE t (id INTEGER)")),
                HashUtil.sha256(List.of("CREATE TABLE t (id INTEGER)")));
    }

    @Test
    void writeSidecar_shouldBeReadableBack() throws IOException {
        Path file = tempDir.resolve("canary_protocol_20260101_000000.db");
        Files.writeString(file, "payload");

        Path sidecar = HashUtil.writeSidecar(file);

        assertEquals(tempDir.resolve("canary_protocol_20260101_000000.db.sha256"), sidecar);
        assertEquals(HashUtil.sha256(file), HashUtil.readSidecar(sidecar));
        assertTrue(Files.readString(sidecar).contains("canary_protocol_20260101_000000.db"));
    }

    @Test
    void sidecarOf_shouldStripTarGzSuffix() {
        assertEquals(tempDir.resolve("canary_backup_x.sha256"),
                HashUtil.sidecarOf(tempDir.resolve("canary_backup_x.tar.gz")));
    }

    @Test
    void readSidecar_shouldLowercaseAndReturnNullWhenEmpty() throws IOException {
        Path upper = tempDir.resolve("upper.sha256");
        Files.writeString(upper, "ABCDEF  backup.db\n");
        Path empty = tempDir.resolve("empty.sha256");
        Files.writeString(empty, "   \n");

        assertEquals("abcdef", HashUtil.readSidecar(upper));
        assertNull(HashUtil.readSidecar(empty));
    }
}
