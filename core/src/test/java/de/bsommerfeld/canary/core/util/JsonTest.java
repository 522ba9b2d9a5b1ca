package de.bsommerfeld.canary.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    record Sample(String backupFile, LocalDateTime createdAt) {
    }

    @TempDir
    Path tempDir;

    @Test
    void writeAtomically_shouldWriteSnakeCaseAndIsoDates() throws IOException {
        ObjectMapper mapper = Json.newMapper();
        Path target = tempDir.resolve("reports/report.json");

        Json.writeAtomically(mapper, new Sample("a.db", LocalDateTime.of(2026, 1, 2, 3, 4, 5)), target);

        JsonNode node = mapper.readTree(target.toFile());
        assertEquals("a.db", node.get("backup_file").asText());
        assertEquals("2026-01-02T03:04:05", node.get("created_at").asText());
        assertFalse(Files.exists(tempDir.resolve("reports/report.json.tmp")));
    }

    @Test
    void writeNew_shouldNeverReplaceAnExistingReport() throws IOException {
        ObjectMapper mapper = Json.newMapper();
        Path target = tempDir.resolve("report.json");
        Json.writeNew(mapper, new Sample("first.db", LocalDateTime.of(2026, 1, 2, 3, 4, 5)), target);

        assertThrows(FileAlreadyExistsException.class,
                () -> Json.writeNew(mapper, new Sample("second.db", LocalDateTime.of(2026, 1, 2, 3, 4, 5)), target));

        assertEquals("first.db", mapper.readTree(target.toFile()).get("backup_file").asText());
    }
}
