package de.bsommerfeld.canary.backup;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BackupTypeTest {

    @Test
    void infer_shouldMapExtensions() {
        assertEquals(BackupType.DATABASE, BackupType.infer(Path.of("canary_protocol_20260101_000000.db")));
        assertEquals(BackupType.JSON_EXPORT, BackupType.infer(Path.of("export.json")));
        assertEquals(BackupType.FULL_SYSTEM, BackupType.infer(Path.of("canary_backup_20260101_000000.tar.gz")));
        assertEquals(BackupType.SQL_DUMP, BackupType.infer(Path.of("dump.SQL")));
        assertEquals(BackupType.ZIP_ARCHIVE, BackupType.infer(Path.of("old.zip")));
    }

    @Test
    void infer_shouldReturnUnknownForOtherFiles() {
        assertEquals(BackupType.UNKNOWN, BackupType.infer(Path.of("canary_backup_x.sha256")));
        assertEquals(BackupType.UNKNOWN, BackupType.infer(Path.of("plain.gz")));
    }
}
