package de.bsommerfeld.canary.archive;

import de.bsommerfeld.canary.core.concurrent.CancellationToken;
import de.bsommerfeld.canary.core.concurrent.DatabaseLock;
import de.bsommerfeld.canary.core.config.ArchivalConfig;
import de.bsommerfeld.canary.core.config.PathsConfig;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.error.NotFoundException;
import de.bsommerfeld.canary.core.error.UnsupportedFormatException;
import de.bsommerfeld.canary.core.event.ApplicationEventBus;
import de.bsommerfeld.canary.core.event.LifecycleEvents.ArchiveItemCompletedEvent;
import de.bsommerfeld.canary.core.io.TarGzReader;
import de.bsommerfeld.canary.db.ConnectionFactory;
import de.bsommerfeld.canary.db.SqliteTransactor;
import de.bsommerfeld.canary.db.migration.MigrationCatalog;
import de.bsommerfeld.canary.db.migration.SchemaMigrationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DataArchivalManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:30:00Z");

    @TempDir
    Path home;

    private SystemPaths paths;
    private ArchivalConfig config;
    private ApplicationEventBus eventBus;
    private DataArchivalManager manager;

    @BeforeEach
    void setUp() throws Exception {
        paths = SystemPaths.of(home, new PathsConfig());
        Path db = paths.database();
        SqliteTransactor transactor = new SqliteTransactor(new ConnectionFactory(db));
        new SchemaMigrationEngine(transactor, new MigrationCatalog(null), new DatabaseLock(db),
                new ApplicationEventBus()).applyPending(null);
        config = new ArchivalConfig();
        eventBus = mock(ApplicationEventBus.class);
        manager = new DataArchivalManager(transactor, paths, config, new DatabaseLock(db),
                Clock.fixed(NOW, ZoneId.of("UTC")), eventBus);
    }

    @Test
    void retentionPolicy_shouldUseConfiguredDefaults() throws Exception {
        assertEquals(365, manager.retentionPolicy("daily_headlines").retentionDays());
        assertEquals(730, manager.retentionPolicy("daily_economic").retentionDays());
        assertEquals(1095, manager.retentionPolicy("individual_article_feedback").retentionDays());
        assertEquals(90, manager.retentionPolicy(DataArchivalManager.LOGS_ITEM).retentionDays());
        assertThrows(NotFoundException.class, () -> manager.retentionPolicy("unknown_table"));
    }

    @Test
    void findCandidates_shouldReturnOnlyRowsOlderThanRetention() throws Exception {
        insertHeadlines();

        List<Map<String, Object>> candidates = manager.findCandidates("daily_headlines", "date");

        assertEquals(1, candidates.size());
        assertEquals("old headline", candidates.get(0).get("title"));
    }

    @Test
    void archiveTable_shouldMoveExpiredRowsIntoSnapshotAndKeepRecentOnes() throws Exception {
        insertHeadlines();

        ArchiveResult result = manager.archiveTable("daily_headlines");

        assertEquals(1, result.archivedCount());
        assertEquals("2025-03-01 08:30:00", result.cutoff());
        assertEquals(paths.archives().resolve("daily_headlines_20260301_083000.json.gz"), result.archiveFile());
        assertTrue(Files.isRegularFile(result.archiveFile()));
        assertEquals(List.of("recent headline"), titles());

        List<ArchivalRecord> history = manager.getArchiveHistory(10);
        assertEquals(1, history.size());
        assertEquals("daily_headlines", history.get(0).tableName());
        assertEquals(1, history.get(0).archivedCount());
        assertEquals(365, history.get(0).retentionDays());
    }

    @Test
    void archiveTable_twiceInOneSecond_shouldKeepEachSnapshot() throws Exception {
        execute("INSERT INTO daily_headlines (date, title) VALUES ('2025-01-25', 'first old')");
        ArchiveResult first = manager.archiveTable("daily_headlines");
        execute("INSERT INTO daily_headlines (date, title) VALUES ('2025-01-20', 'second old')");
        ArchiveResult second = manager.archiveTable("daily_headlines");

        assertEquals(paths.archives().resolve("daily_headlines_20260301_083000.json.gz"), first.archiveFile());
        assertEquals(paths.archives().resolve("daily_headlines_20260301_083000_1.json.gz"), second.archiveFile());
        assertTrue(titles().isEmpty());

        assertEquals(1, manager.restoreFromArchive(first.archiveFile()).restored());
        assertEquals(List.of("first old"), titles());
        assertEquals(1, manager.restoreFromArchive(second.archiveFile()).restored());
        assertEquals(2, titles().size());
        assertTrue(titles().contains("second old"));

        List<String> recordedFiles = manager.getArchiveHistory(10).stream()
                .map(ArchivalRecord::archiveFile)
                .sorted()
                .collect(Collectors.toList());
        assertEquals(List.of(first.archiveFile().toString(), second.archiveFile().toString()), recordedFiles);
    }

    @Test
    void archiveTable_withoutCandidates_shouldChangeNothing() throws Exception {
        execute("INSERT INTO daily_headlines (date, title) VALUES ('2026-02-19', 'recent headline')");

        ArchiveResult result = manager.archiveTable("daily_headlines");

        assertFalse(result.archivedAnything());
        assertNull(result.archiveFile());
        assertFalse(Files.exists(paths.archives()));
        assertTrue(manager.getArchiveHistory(10).isEmpty());
    }

    @Test
    void archiveTable_shouldNeverArchiveRowsWithoutParseableDate() throws Exception {
        execute("INSERT INTO daily_headlines (date, title) VALUES (NULL, 'undated')",
                "INSERT INTO daily_headlines (date, title) VALUES ('someday', 'garbled')");

        assertFalse(manager.archiveTable("daily_headlines").archivedAnything());
        assertEquals(2, titles().size());
    }

    @Test
    void archiveTable_whenArchiveCannotBeWritten_shouldKeepAllRows() throws Exception {
        insertHeadlines();
        Files.createDirectories(paths.archives().getParent());
        Files.writeString(paths.archives(), "not a directory");

        assertThrows(java.io.IOException.class, () -> manager.archiveTable("daily_headlines"));

        assertEquals(2, titles().size());
        assertTrue(manager.getArchiveHistory(10).isEmpty());
    }

    @Test
    void archiveTable_shouldRejectMissingTableOrColumn() {
        config.setTables(List.of(
                new ArchivalConfig.TablePolicy("ghost", "date", 30),
                new ArchivalConfig.TablePolicy("daily_headlines", "published_on", 30)));

        assertThrows(NotFoundException.class, () -> manager.archiveTable("ghost"));
        assertThrows(NotFoundException.class, () -> manager.archiveTable("daily_headlines"));
    }

    @Test
    void restoreFromArchive_shouldReinsertRowsAndSkipExistingKeys() throws Exception {
        insertHeadlines();
        long oldId = idOf("old headline");
        ArchiveResult archived = manager.archiveTable("daily_headlines");

        ArchiveRestoreResult restored = manager.restoreFromArchive(archived.archiveFile());

        assertEquals(1, restored.restored());
        assertEquals(0, restored.skipped());
        assertEquals(oldId, idOf("old headline"));
        assertEquals(2, titles().size());

        ArchiveRestoreResult again = manager.restoreFromArchive(archived.archiveFile());
        assertEquals(0, again.restored());
        assertEquals(1, again.skipped());
        assertEquals(2, titles().size());
    }

    @Test
    void restoreFromArchive_shouldRoundTripRowidTablesWithBlobs() throws Exception {
        execute("CREATE TABLE attachments (date TEXT, name TEXT, payload BLOB)",
                "INSERT INTO attachments (date, name, payload) VALUES ('2025-12-01', 'scan', X'00FF10')",
                "INSERT INTO attachments (date, name, payload) VALUES ('2026-02-28', 'fresh', X'01')");
        config.setTables(List.of(new ArchivalConfig.TablePolicy("attachments", "date", 30)));

        ArchiveResult archived = manager.archiveTable("attachments");
        assertEquals(1, archived.archivedCount());

        ArchiveRestoreResult restored = manager.restoreFromArchive(archived.archiveFile());
        assertEquals(1, restored.restored());

        try (Connection conn = new ConnectionFactory(paths.database()).open();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT payload FROM attachments WHERE name = 'scan'")) {
            assertTrue(rs.next());
            assertArrayEquals(new byte[] { 0x00, (byte) 0xFF, 0x10 }, rs.getBytes(1));
        }
    }

    @Test
    void restoreFromArchive_shouldRejectMissingFilesAndLogBundles() throws Exception {
        assertThrows(NotFoundException.class,
                () -> manager.restoreFromArchive(paths.archives().resolve("nothing.json.gz")));

        writeLog("old.log", "2025-11-01T00:00:00Z");
        ArchiveResult logs = manager.archiveLogs();
        assertThrows(UnsupportedFormatException.class, () -> manager.restoreFromArchive(logs.archiveFile()));
    }

    @Test
    void archiveLogs_shouldBundleAndRemoveOnlyExpiredLogs() throws Exception {
        Path old = writeLog("canary.2025-11-01.log", "2025-11-01T00:00:00Z");
        Path recent = writeLog("canary.log", "2026-02-28T00:00:00Z");

        ArchiveResult result = manager.archiveLogs();

        assertEquals(1, result.archivedCount());
        assertEquals("logs_20260301_083000.tar.gz", result.archiveFile().getFileName().toString());
        assertEquals(List.of("logs/canary.2025-11-01.log"), TarGzReader.entryNames(result.archiveFile()));
        assertFalse(Files.exists(old));
        assertTrue(Files.exists(recent));
    }

    @Test
    void archiveLogs_twiceInOneSecond_shouldWriteSeparateBundles() throws Exception {
        writeLog("canary.2025-10-01.log", "2025-10-01T00:00:00Z");
        ArchiveResult first = manager.archiveLogs();
        writeLog("canary.2025-10-02.log", "2025-10-02T00:00:00Z");
        ArchiveResult second = manager.archiveLogs();

        assertNotEquals(first.archiveFile(), second.archiveFile());
        assertEquals(List.of("logs/canary.2025-10-01.log"), TarGzReader.entryNames(first.archiveFile()));
        assertEquals(List.of("logs/canary.2025-10-02.log"), TarGzReader.entryNames(second.archiveFile()));
    }

    @Test
    void archiveLogs_withoutLogDirectory_shouldBeNoOp() throws Exception {
        assertFalse(manager.archiveLogs().archivedAnything());
    }

    @Test
    void runFullArchival_shouldIsolateFailuresAndWriteReport() throws Exception {
        insertHeadlines();
        config.setTables(List.of(
                new ArchivalConfig.TablePolicy("ghost", "date", 30),
                new ArchivalConfig.TablePolicy("daily_headlines", "date", 365)));

        ArchivalReport report = manager.runFullArchival(CancellationToken.none());

        assertEquals(3, report.items().size());
        assertNotNull(report.items().get(0).error());
        assertEquals(1, report.items().get(1).archived());
        assertEquals(DataArchivalManager.LOGS_ITEM, report.items().get(2).item());
        assertEquals(1, report.totalArchived());
        assertEquals(1, report.failedItems());
        assertFalse(report.cancelled());
        assertTrue(Files.exists(paths.archives().resolve("archival_report_20260301_083000.json")));
        verify(eventBus, times(3)).post(any(ArchiveItemCompletedEvent.class));
    }

    @Test
    void runFullArchival_twiceInOneSecond_shouldKeepBothReports() throws Exception {
        manager.runFullArchival(CancellationToken.none());
        manager.runFullArchival(CancellationToken.none());

        assertTrue(Files.exists(paths.archives().resolve("archival_report_20260301_083000.json")));
        assertTrue(Files.exists(paths.archives().resolve("archival_report_20260301_083000_1.json")));
    }

    @Test
    void runFullArchival_whenCancelled_shouldStopBeforeNextItem() throws Exception {
        insertHeadlines();
        CancellationToken token = new CancellationToken();
        token.cancel();

        ArchivalReport report = manager.runFullArchival(token);

        assertTrue(report.cancelled());
        assertTrue(report.items().isEmpty());
        assertEquals(2, titles().size());
    }

    @Test
    void dryRun_shouldCountCandidatesWithoutChanges() throws Exception {
        insertHeadlines();
        config.setTables(List.of(
                new ArchivalConfig.TablePolicy("daily_headlines", "date", 365),
                new ArchivalConfig.TablePolicy("ghost", "date", 30)));

        List<CandidateCount> counts = manager.dryRun();

        assertEquals(1, counts.get(0).candidates());
        assertNull(counts.get(0).error());
        assertNotNull(counts.get(1).error());
        assertEquals(2, titles().size());
        assertFalse(Files.exists(paths.archives()));
    }

    @Test
    void getArchiveSummary_shouldGroupByKindAndIgnoreReports() throws Exception {
        insertHeadlines();
        writeLog("old.log", "2025-11-01T00:00:00Z");
        config.setTables(List.of(new ArchivalConfig.TablePolicy("daily_headlines", "date", 365)));
        manager.runFullArchival(CancellationToken.none());

        ArchiveSummary summary = manager.getArchiveSummary();

        assertEquals(2, summary.totalFiles());
        assertEquals(1, summary.byType().get(ArchiveKind.TABLE_SNAPSHOT).files());
        assertEquals(1, summary.byType().get(ArchiveKind.LOG_BUNDLE).files());
        assertTrue(summary.totalBytes() > 0);
        assertNotNull(summary.oldest());
        assertFalse(summary.newest().isBefore(summary.oldest()));
    }

    @Test
    void getArchiveSummary_withoutArchives_shouldBeEmpty() throws Exception {
        ArchiveSummary summary = manager.getArchiveSummary();

        assertEquals(0, summary.totalFiles());
        assertNull(summary.oldest());
    }

    private void insertHeadlines() throws SQLException {
        execute("INSERT INTO daily_headlines (date, source, title) VALUES ('2025-01-25', 'wire', 'old headline')",
                "INSERT INTO daily_headlines (date, source, title) VALUES ('2026-02-19', 'wire', 'recent headline')");
    }

    private Path writeLog(String name, String modifiedAt) throws Exception {
        Files.createDirectories(paths.logs());
        Path file = paths.logs().resolve(name);
        Files.writeString(file, "log line\n");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse(modifiedAt)));
        return file;
    }

    private List<String> titles() throws SQLException {
        try (Connection conn = new ConnectionFactory(paths.database()).open();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT title FROM daily_headlines ORDER BY date")) {
            List<String> titles = new java.util.ArrayList<>();
            while (rs.next()) {
                titles.add(rs.getString(1));
            }
            return titles;
        }
    }

    private long idOf(String title) throws SQLException {
        try (Connection conn = new ConnectionFactory(paths.database()).open();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT id FROM daily_headlines WHERE title = '" + title + "'")) {
            return rs.next() ? rs.getLong(1) : -1;
        }
    }

    private void execute(String... statements) throws SQLException {
        try (Connection conn = new ConnectionFactory(paths.database()).open(); Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }
}
