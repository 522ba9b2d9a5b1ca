package de.bsommerfeld.canary.backup;

import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.config.VerificationConfig;
import de.bsommerfeld.canary.core.error.NotFoundException;
import de.bsommerfeld.canary.core.event.ApplicationEventBus;
import de.bsommerfeld.canary.core.io.TarGzReader;
import de.bsommerfeld.canary.core.util.HashUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackupCreatorTest {

    @TempDir
    Path home;

    private SystemPaths paths;
    private BackupCreator creator;

    @BeforeEach
    void setUp() {
        paths = TestDatabases.paths(home);
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T08:30:00Z"), ZoneId.of("UTC"));
        creator = new BackupCreator(paths, clock);
    }

    @Test
    void createDatabaseBackup_shouldWriteVerifiableSnapshotWithSidecar() throws Exception {
        TestDatabases.createLive(paths.database());

        BackupArtifact artifact = creator.createDatabaseBackup();

        assertEquals("canary_protocol_20260301_083000.db", artifact.fileName());
        assertEquals(BackupType.DATABASE, artifact.type());
        Path sidecar = HashUtil.sidecarOf(artifact.file());
        assertEquals(artifact.checksum(), HashUtil.readSidecar(sidecar));
        BackupIntegrityVerifier verifier = new BackupIntegrityVerifier(paths, new VerificationConfig(),
                Clock.systemDefaultZone(), new ApplicationEventBus());
        assertTrue(verifier.verifyIntegrity(artifact.file()).overallValid());
    }

    @Test
    void createFullSystemBackup_shouldBundleDataConfigAndLogs() throws Exception {
        TestDatabases.createLive(paths.database());
        Files.createDirectories(paths.config());
        Files.writeString(paths.config().resolve("lifecycle.yaml"), "restore: {}\n");
        Files.createDirectories(paths.logs());
        Files.writeString(paths.logs().resolve("canary.log"), "line\n");

        BackupArtifact artifact = creator.createFullSystemBackup();

        assertEquals("canary_backup_20260301_083000.tar.gz", artifact.fileName());
        assertEquals(BackupType.FULL_SYSTEM, artifact.type());
        assertTrue(Files.exists(paths.backups().resolve("canary_backup_20260301_083000.sha256")));
        List<String> entries = TarGzReader.entryNames(artifact.file());
        String root = "canary_backup_20260301_083000/";
        assertTrue(entries.contains(root + "data/canary_protocol.db"));
        assertTrue(entries.contains(root + "config/lifecycle.yaml"));
        assertTrue(entries.contains(root + "logs/canary.log"));
        assertTrue(entries.contains(root + "backup_info.txt"));
    }

    @Test
    void createDatabaseBackup_shouldFailWithoutLiveDatabase() {
        assertThrows(NotFoundException.class, () -> creator.createDatabaseBackup());
        assertThrows(NotFoundException.class, () -> creator.createFullSystemBackup());
    }
}
