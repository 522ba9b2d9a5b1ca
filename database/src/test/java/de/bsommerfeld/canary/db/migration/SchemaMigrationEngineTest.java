package de.bsommerfeld.canary.db.migration;

import de.bsommerfeld.canary.core.concurrent.DatabaseLock;
import de.bsommerfeld.canary.core.error.MigrationException;
import de.bsommerfeld.canary.core.error.MissingRollbackException;
import de.bsommerfeld.canary.core.error.NotFoundException;
import de.bsommerfeld.canary.core.event.ApplicationEventBus;
import de.bsommerfeld.canary.core.event.LifecycleEvents.MigrationAppliedEvent;
import de.bsommerfeld.canary.core.event.LifecycleEvents.MigrationRolledBackEvent;
import de.bsommerfeld.canary.db.ConnectionFactory;
import de.bsommerfeld.canary.db.SchemaInspector;
import de.bsommerfeld.canary.db.SqliteTransactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Integration tests against a real temporary SQLite database. Tests that need
 * custom definitions use an empty built-in catalog and write JSON files into
 * the external migrations directory.
 */
class SchemaMigrationEngineTest {

    @TempDir
    Path tempDir;

    private Path dbFile;
    private Path migrationsDir;
    private ConnectionFactory connections;
    private ApplicationEventBus eventBus;

    @BeforeEach
    void setUp() throws IOException {
        dbFile = tempDir.resolve("data/canary_protocol.db");
        migrationsDir = tempDir.resolve("migrations");
        Files.createDirectories(migrationsDir);
        connections = new ConnectionFactory(dbFile);
        eventBus = mock(ApplicationEventBus.class);
    }

    private SchemaMigrationEngine builtInEngine() {
        return engine(new MigrationCatalog(migrationsDir));
    }

    private SchemaMigrationEngine customEngine() {
        return engine(new MigrationCatalog("migrations/absent.json", migrationsDir));
    }

    private SchemaMigrationEngine engine(MigrationCatalog catalog) {
        return new SchemaMigrationEngine(new SqliteTransactor(connections), catalog,
                new DatabaseLock(dbFile, 1000), eventBus);
    }

    private void define(String version, String up, String down) throws IOException {
        String downJson = down == null ? "[]" : "[\"" + down + "\"]";
        Files.writeString(migrationsDir.resolve(version + ".json"),
                "{\"version\":\"" + version + "\",\"description\":\"m " + version + "\",\"up\":[\"" + up
                        + "\"],\"down\":" + downJson + "}");
    }

    private boolean tableExists(String table) throws SQLException {
        try (Connection conn = connections.open()) {
            return SchemaInspector.tableExists(conn, table);
        }
    }

    // -- Apply --

    @Test
    void getCurrentVersion_shouldReturnSentinelOnFreshDatabase() {
        assertEquals("0.0.0", builtInEngine().getCurrentVersion());
    }

    @Test
    void applyPending_shouldApplyBuiltInCatalog() throws Exception {
        SchemaMigrationEngine engine = builtInEngine();

        MigrationResult result = engine.applyPending(null);

        assertEquals(3, result.appliedCount());
        assertEquals(List.of("1.0.0", "1.1.0", "1.2.0"), result.appliedVersions());
        assertEquals("1.2.0", result.currentVersion());
        assertEquals("1.2.0", engine.getCurrentVersion());
        assertTrue(tableExists("weekly_digests"));
        assertTrue(tableExists("individual_article_feedback"));
        assertTrue(tableExists("restore_history"));
        verify(eventBus, times(3)).post(any(MigrationAppliedEvent.class));
    }

    @Test
    void applyPending_shouldBeIdempotent() throws Exception {
        SchemaMigrationEngine engine = builtInEngine();
        engine.applyPending(null);

        MigrationResult second = engine.applyPending(null);

        assertEquals(0, second.appliedCount());
        assertEquals("1.2.0", second.currentVersion());
        assertEquals(3, engine.getAppliedMigrations().size());
    }

    @Test
    void applyPending_shouldStopAtTargetVersion() throws Exception {
        SchemaMigrationEngine engine = builtInEngine();

        MigrationResult result = engine.applyPending("1.1.0");

        assertEquals(List.of("1.0.0", "1.1.0"), result.appliedVersions());
        assertFalse(tableExists("restore_history"));
    }

    @Test
    void applyPending_shouldRollBackFailingMigrationAndAbortBatch() throws Exception {
        define("1.0.0", "CREATE TABLE a (id INTEGER)", null);
        define("1.2.0", "CREATE TABLE c (id INTEGER)", null);
        Files.writeString(migrationsDir.resolve("1.1.0.json"), """
                {"version": "1.1.0", "description": "broken",
                 "up": ["CREATE TABLE b (id INTEGER)", "INSERT INTO missing VALUES (1)"]}
                """);
        SchemaMigrationEngine engine = customEngine();

        MigrationException e = assertThrows(MigrationException.class, () -> engine.applyPending(null));

        assertEquals("1.1.0", e.getVersion());
        assertEquals(List.of("1.0.0"), e.getAppliedBeforeFailure());
        assertEquals("1.0.0", engine.getCurrentVersion());
        assertTrue(tableExists("a"));
        assertFalse(tableExists("b"), "failed migration must be rolled back completely");
        assertFalse(tableExists("c"), "later migrations must not run");
    }

    @Test
    void applyPending_shouldRefuseMigrationOlderThanHead() throws Exception {
        define("1.0.0", "CREATE TABLE a (id INTEGER)", null);
        define("2.0.0", "CREATE TABLE c (id INTEGER)", null);
        SchemaMigrationEngine engine = customEngine();
        engine.applyPending(null);
        define("1.5.0", "CREATE TABLE b (id INTEGER)", null);

        MigrationException e = assertThrows(MigrationException.class, () -> engine.applyPending(null));

        assertEquals("1.5.0", e.getVersion());
        assertFalse(tableExists("b"));
        assertEquals("2.0.0", engine.getCurrentVersion());
    }

    // -- Rollback --

    @Test
    void rollback_shouldRevertHead() throws Exception {
        SchemaMigrationEngine engine = builtInEngine();
        engine.applyPending(null);

        engine.rollback("1.2.0");

        assertEquals("1.1.0", engine.getCurrentVersion());
        assertFalse(tableExists("restore_history"));
        assertTrue(tableExists("individual_article_feedback"));
        verify(eventBus).post(new MigrationRolledBackEvent("1.2.0"));
    }

    @Test
    void rollback_shouldRefuseNonHeadVersion() throws Exception {
        SchemaMigrationEngine engine = builtInEngine();
        engine.applyPending(null);

        MigrationException e = assertThrows(MigrationException.class, () -> engine.rollback("1.0.0"));

        assertFalse(e instanceof MissingRollbackException);
        assertEquals("1.2.0", engine.getCurrentVersion());
        assertTrue(tableExists("weekly_digests"));
    }

    @Test
    void rollback_shouldFailForUnknownOrUnappliedVersion() throws Exception {
        SchemaMigrationEngine engine = builtInEngine();
        engine.applyPending("1.0.0");

        assertThrows(NotFoundException.class, () -> engine.rollback("9.9.9"));
        assertThrows(NotFoundException.class, () -> engine.rollback("1.1.0"));
    }

    @Test
    void rollback_shouldFailWithoutDownStatements() throws Exception {
        define("1.0.0", "CREATE TABLE a (id INTEGER)", null);
        SchemaMigrationEngine engine = customEngine();
        engine.applyPending(null);

        assertThrows(MissingRollbackException.class, () -> engine.rollback("1.0.0"));
        assertEquals("1.0.0", engine.getCurrentVersion());
    }

    @Test
    void applyAfterRollback_shouldReapply() throws Exception {
        define("1.0.0", "CREATE TABLE a (id INTEGER)", "DROP TABLE a");
        SchemaMigrationEngine engine = customEngine();
        engine.applyPending(null);
        engine.rollback("1.0.0");

        MigrationResult result = engine.applyPending(null);

        assertEquals(List.of("1.0.0"), result.appliedVersions());
        assertTrue(tableExists("a"));
    }

    // -- Status & files --

    @Test
    void status_shouldReportPendingAndDrift() throws Exception {
        define("1.0.0", "CREATE TABLE a (id INTEGER)", null);
        define("1.1.0", "CREATE TABLE b (id INTEGER)", null);
        SchemaMigrationEngine engine = customEngine();
        engine.applyPending("1.0.0");
        define("1.0.0", "CREATE TABLE a (id INTEGER, name TEXT)", null);

        MigrationStatus status = engine.status();

        assertEquals("1.0.0", status.currentVersion());
        assertEquals(List.of("1.0.0"), status.applied());
        assertEquals(List.of("1.1.0"), status.pending());
        assertEquals(List.of("1.0.0"), status.drifted());
        assertFalse(status.upToDate());
    }

    @Test
    void ensureTrackingTable_shouldUpgradeLegacyTableWithoutChecksum() throws Exception {
        try (Connection conn = connections.open(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE schema_migrations (version TEXT PRIMARY KEY, description TEXT NOT NULL, "
                    + "applied_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)");
            stmt.execute("INSERT INTO schema_migrations (version, description) VALUES ('1.0.0', 'legacy')");
        }
        SchemaMigrationEngine engine = builtInEngine();

        engine.ensureTrackingTable();

        AppliedMigration legacy = engine.getAppliedMigrations().get(0);
        assertNull(legacy.checksum());
        assertTrue(engine.status().drifted().isEmpty());
    }

    @Test
    void createMigrationFile_shouldWriteLoadableDefinition() throws Exception {
        SchemaMigrationEngine engine = builtInEngine();

        Path file = engine.createMigrationFile("1.3.0", "Add Keyword Index!",
                List.of("CREATE INDEX IF NOT EXISTS idx_kw ON keyword_performance(keyword)"),
                List.of("DROP INDEX IF EXISTS idx_kw"));

        assertEquals("1.3.0_add_keyword_index.json", file.getFileName().toString());
        assertEquals("1.3.0", engine.status().pending().get(3));
        assertThrows(MigrationException.class,
                () -> engine.createMigrationFile("1.3.0", "again", List.of("SELECT 1"), List.of()));
    }
}
