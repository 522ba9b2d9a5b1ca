package de.bsommerfeld.canary.db.migration;

import de.bsommerfeld.canary.core.error.MigrationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MigrationCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReturnBuiltInCatalogInOrder() throws MigrationException {
        List<Migration> migrations = new MigrationCatalog(null).load();

        assertEquals(List.of("1.0.0", "1.1.0", "1.2.0"),
                migrations.stream().map(Migration::version).collect(Collectors.toList()));
        assertEquals(6, migrations.get(0).up().size());
        assertTrue(migrations.stream().allMatch(Migration::hasRollback));
    }

    @Test
    void load_shouldMergeExternalDefinitions() throws Exception {
        Files.writeString(tempDir.resolve("1.1.5_add_notes.json"), """
                {"version": "1.1.5", "description": "Add notes", "up": ["CREATE TABLE notes (id INTEGER)"]}
                """);
        Files.writeString(tempDir.resolve("README.txt"), "ignored");

        List<Migration> migrations = new MigrationCatalog(tempDir).load();

        assertEquals(List.of("1.0.0", "1.1.0", "1.1.5", "1.2.0"),
                migrations.stream().map(Migration::version).collect(Collectors.toList()));
        assertFalse(migrations.get(2).hasRollback());
    }

    @Test
    void load_shouldRejectDuplicateVersions() throws IOException {
        Files.writeString(tempDir.resolve("dup.json"), """
                {"version": "1.1", "description": "Clash", "up": ["SELECT 1"]}
                """);

        MigrationException e = assertThrows(MigrationException.class, () -> new MigrationCatalog(tempDir).load());
        assertEquals("1.1", e.getVersion());
    }

    @Test
    void load_shouldRejectMigrationWithoutUpStatements() throws IOException {
        Files.writeString(tempDir.resolve("empty.json"), """
                {"version": "9.0.0", "description": "Nothing", "up": []}
                """);

        assertThrows(MigrationException.class, () -> new MigrationCatalog(tempDir).load());
    }

    @Test
    void load_shouldRejectMalformedJson() throws IOException {
        Files.writeString(tempDir.resolve("broken.json"), "{ not json");

        MigrationException e = assertThrows(MigrationException.class, () -> new MigrationCatalog(tempDir).load());
        assertNotNull(e.getCause());
    }

    @Test
    void checksum_shouldChangeWithStatements() {
        Migration a = new Migration("1.0.0", "a", List.of("CREATE TABLE t (id INTEGER)"), null);
        Migration b = new Migration("1.0.0", "a", List.of("CREATE TABLE t (id TEXT)"), null);

        assertNotEquals(a.checksum(), b.checksum());
        assertTrue(a.down().isEmpty());
    }
}
