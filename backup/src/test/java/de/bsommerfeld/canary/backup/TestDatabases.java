package de.bsommerfeld.canary.backup;

import de.bsommerfeld.canary.core.concurrent.DatabaseLock;
import de.bsommerfeld.canary.core.config.PathsConfig;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.event.ApplicationEventBus;
import de.bsommerfeld.canary.db.ConnectionFactory;
import de.bsommerfeld.canary.db.SqliteTransactor;
import de.bsommerfeld.canary.db.migration.MigrationCatalog;
import de.bsommerfeld.canary.db.migration.SchemaMigrationEngine;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/** Builds migrated SQLite databases for the backup tests. */
final class TestDatabases {

    private TestDatabases() {
    }

    static SystemPaths paths(Path home) {
        return SystemPaths.of(home, new PathsConfig());
    }

    /** Applies the built-in migrations and inserts a few digests and feedback rows. */
    static void createLive(Path dbFile) throws Exception {
        new SchemaMigrationEngine(new SqliteTransactor(new ConnectionFactory(dbFile)), new MigrationCatalog(null),
                new DatabaseLock(dbFile), new ApplicationEventBus()).applyPending(null);
        execute(dbFile,
                "INSERT INTO weekly_digests (date, content, urgency_score) VALUES ('2026-01-04', 'digest a', 3.5)",
                "INSERT INTO weekly_digests (date, content, urgency_score) VALUES ('2026-01-11', 'digest b', 6.0)",
                "INSERT INTO user_feedback (digest_date, rating, comments) VALUES ('2026-01-04', 4, 'useful')",
                "INSERT INTO daily_headlines (date, source, title) VALUES ('2026-01-05', 'wire', 'headline')");
    }

    static void execute(Path dbFile, String... statements) throws SQLException {
        try (Connection conn = new ConnectionFactory(dbFile).open(); Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }
}
