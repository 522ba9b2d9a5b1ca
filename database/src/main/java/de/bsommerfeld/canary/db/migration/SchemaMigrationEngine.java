package de.bsommerfeld.canary.db.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import de.bsommerfeld.canary.core.concurrent.DatabaseLock;
import de.bsommerfeld.canary.core.error.DataAccessException;
import de.bsommerfeld.canary.core.error.MigrationException;
import de.bsommerfeld.canary.core.error.MissingRollbackException;
import de.bsommerfeld.canary.core.error.NotFoundException;
import de.bsommerfeld.canary.core.event.ApplicationEventBus;
import de.bsommerfeld.canary.core.event.LifecycleEvents.MigrationAppliedEvent;
import de.bsommerfeld.canary.core.event.LifecycleEvents.MigrationRolledBackEvent;
import de.bsommerfeld.canary.core.util.Json;
import de.bsommerfeld.canary.db.SchemaInspector;
import de.bsommerfeld.canary.db.SqlLoader;
import de.bsommerfeld.canary.db.Transactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies and rolls back versioned schema migrations on the live database.
 *
 * <h3>Tracking</h3>
 * Applied versions are recorded in {@code schema_migrations}. The applied set
 * is always an unbroken ascending prefix of the defined migrations: pending
 * migrations older than the current head are refused, and only the head can
 * be rolled back.
 *
 * <h3>Transaction boundaries</h3>
 * Every migration runs its statements and writes its tracking row in one
 * transaction. A failing migration is rolled back completely and the batch
 * stops; migrations committed earlier in the same batch stay applied.
 * SQLite executes DDL transactionally, so a half-created schema is never
 * left behind.
 */
public class SchemaMigrationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrationEngine.class);

    private final Transactor transactor;
    private final MigrationCatalog catalog;
    private final DatabaseLock lock;
    private final ApplicationEventBus eventBus;
    private final ObjectMapper mapper = Json.newMapper();

    @Inject
    public SchemaMigrationEngine(Transactor transactor, MigrationCatalog catalog, DatabaseLock lock,
            ApplicationEventBus eventBus) {
        this.transactor = transactor;
        this.catalog = catalog;
        this.lock = lock;
        this.eventBus = eventBus;
    }

    /**
     * Creates {@code schema_migrations} if it does not exist. Tracking tables
     * created before checksums were recorded get the column added.
     */
    public void ensureTrackingTable() {
        transactor.inTransaction(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(SqlLoader.load("create-schema-migrations"));
            }
            boolean hasChecksum = SchemaInspector.columns(conn, "schema_migrations").stream()
                    .anyMatch(c -> c.name().equalsIgnoreCase("checksum"));
            if (!hasChecksum) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(SqlLoader.load("add-migration-checksum"));
                }
                LOG.info("[MIGRATE] Added checksum column to legacy tracking table");
            }
            return null;
        });
    }

    /** Highest applied version, or {@code 0.0.0} if nothing has been applied. */
    public String getCurrentVersion() {
        List<AppliedMigration> applied = getAppliedMigrations();
        return applied.isEmpty() ? MigrationVersion.ZERO.toString() : applied.get(applied.size() - 1).version();
    }

    /** Applied migrations in ascending version order. */
    public List<AppliedMigration> getAppliedMigrations() {
        ensureTrackingTable();
        return transactor.withConnection(SchemaMigrationEngine::readApplied);
    }

    public List<Migration> loadDefinedMigrations() throws MigrationException {
        return catalog.load();
    }

    /**
     * Applies every pending migration up to and including
     * {@code targetVersion}, in ascending order.
     *
     * @param targetVersion upper bound, or {@code null} for all pending
     * @throws MigrationException if a pending migration would leave a gap
     *                            below the current head, or a migration fails
     * @throws IOException        if the database lock cannot be obtained
     */
    public MigrationResult applyPending(String targetVersion) throws MigrationException, IOException {
        MigrationVersion target = targetVersion == null ? null : MigrationVersion.parse(targetVersion);
        List<Migration> defined = loadDefinedMigrations();

        try (DatabaseLock.Handle ignored = lock.acquire("migration")) {
            ensureTrackingTable();
            List<AppliedMigration> applied = transactor.withConnection(SchemaMigrationEngine::readApplied);
            MigrationVersion current = applied.isEmpty()
                    ? MigrationVersion.ZERO
                    : MigrationVersion.parse(applied.get(applied.size() - 1).version());

            List<Migration> pending = pending(defined, applied).stream()
                    .filter(m -> target == null || !m.parsedVersion().isAfter(target))
                    .collect(Collectors.toList());

            for (Migration m : pending) {
                if (current.isAfter(m.parsedVersion())) {
                    throw new MigrationException(m.version(), "Pending migration " + m.version()
                            + " is older than current version " + current + "; refusing to create a gap");
                }
            }

            if (pending.isEmpty()) {
                LOG.info("[MIGRATE] Database is up to date at {}", current);
                return new MigrationResult(0, List.of(), current.toString());
            }

            List<String> done = new ArrayList<>();
            for (Migration m : pending) {
                try {
                    apply(m);
                } catch (DataAccessException e) {
                    LOG.error("[MIGRATE] Migration {} failed, batch aborted after {} applied", m.version(),
                            done.size(), e);
                    throw new MigrationException(m.version(),
                            "Migration " + m.version() + " failed: " + rootMessage(e), done, e);
                }
                done.add(m.version());
                current = m.parsedVersion();
                LOG.info("[MIGRATE] Applied {}: {}", m.version(), m.description());
                eventBus.post(new MigrationAppliedEvent(m.version(), m.description()));
            }
            return new MigrationResult(done.size(), done, current.toString());
        }
    }

    private void apply(Migration m) {
        transactor.inTransaction(conn -> {
            try (Statement stmt = conn.createStatement()) {
                for (String sql : m.up()) {
                    stmt.execute(sql);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-migration"))) {
                ps.setString(1, m.version());
                ps.setString(2, m.description());
                ps.setString(3, m.checksum());
                ps.executeUpdate();
            }
            return null;
        });
    }

    /**
     * Rolls back the current head migration.
     *
     * @throws NotFoundException         if the version is not defined or not
     *                                   applied
     * @throws MissingRollbackException  if the migration has no down
     *                                   statements
     * @throws MigrationException        if the version is not the current
     *                                   head, or the down statements fail
     * @throws IOException               if the database lock cannot be
     *                                   obtained
     */
    public void rollback(String version) throws NotFoundException, MigrationException, IOException {
        MigrationVersion requested = MigrationVersion.parse(version);
        Migration migration = loadDefinedMigrations().stream()
                .filter(m -> m.parsedVersion().equals(requested))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Migration " + version + " is not defined"));

        try (DatabaseLock.Handle ignored = lock.acquire("rollback")) {
            ensureTrackingTable();
            List<AppliedMigration> applied = transactor.withConnection(SchemaMigrationEngine::readApplied);
            Optional<AppliedMigration> row = applied.stream()
                    .filter(a -> MigrationVersion.parse(a.version()).equals(requested))
                    .findFirst();
            if (row.isEmpty()) {
                throw new NotFoundException("Migration " + version + " is not applied");
            }
            String head = applied.get(applied.size() - 1).version();
            if (row.get() != applied.get(applied.size() - 1)) {
                throw new MigrationException(version,
                        "Only the current version " + head + " can be rolled back, not " + version);
            }
            if (!migration.hasRollback()) {
                throw new MissingRollbackException(version);
            }

            try {
                transactor.inTransaction(conn -> {
                    try (Statement stmt = conn.createStatement()) {
                        for (String sql : migration.down()) {
                            stmt.execute(sql);
                        }
                    }
                    try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-migration"))) {
                        ps.setString(1, row.get().version());
                        ps.executeUpdate();
                    }
                    return null;
                });
            } catch (DataAccessException e) {
                LOG.error("[MIGRATE] Rollback of {} failed", version, e);
                throw new MigrationException(version, "Rollback of " + version + " failed: " + rootMessage(e),
                        List.of(), e);
            }
            LOG.info("[MIGRATE] Rolled back {}", version);
            eventBus.post(new MigrationRolledBackEvent(version));
        }
    }

    /** Current version, applied and pending versions, and checksum drift. */
    public MigrationStatus status() throws MigrationException {
        List<Migration> defined = loadDefinedMigrations();
        List<AppliedMigration> applied = getAppliedMigrations();
        Map<MigrationVersion, Migration> byVersion = defined.stream()
                .collect(Collectors.toMap(Migration::parsedVersion, Function.identity()));

        List<String> drifted = new ArrayList<>();
        for (AppliedMigration a : applied) {
            Migration m = byVersion.get(MigrationVersion.parse(a.version()));
            if (m != null && a.checksum() != null && !a.checksum().equals(m.checksum())) {
                LOG.warn("[MIGRATE] Definition of applied migration {} has changed", a.version());
                drifted.add(a.version());
            }
        }

        String current = applied.isEmpty() ? MigrationVersion.ZERO.toString() : applied.get(applied.size() - 1).version();
        return new MigrationStatus(
                current,
                applied.stream().map(AppliedMigration::version).collect(Collectors.toList()),
                pending(defined, applied).stream().map(Migration::version).collect(Collectors.toList()),
                drifted);
    }

    /**
     * Writes a new definition file {@code <version>_<slug>.json} into the
     * external migrations directory.
     *
     * @throws MigrationException if the version is invalid or already defined
     */
    public Path createMigrationFile(String version, String description, List<String> up, List<String> down)
            throws MigrationException, IOException {
        if (!MigrationVersion.isValid(version)) {
            throw new MigrationException(version, "Invalid migration version '" + version + "'");
        }
        if (up == null || up.isEmpty()) {
            throw new MigrationException(version, "Migration " + version + " has no up statements");
        }
        MigrationVersion parsed = MigrationVersion.parse(version);
        boolean exists = loadDefinedMigrations().stream().anyMatch(m -> m.parsedVersion().equals(parsed));
        if (exists) {
            throw new MigrationException(version, "Migration " + version + " is already defined");
        }

        Path dir = catalog.externalDirectory();
        if (dir == null) {
            throw new MigrationException(version, "No external migrations directory configured");
        }
        Files.createDirectories(dir);
        Path file = dir.resolve(version + "_" + slug(description) + ".json");
        Json.writeAtomically(mapper, new Migration(version, description, up, down), file);
        LOG.info("[MIGRATE] Created migration file {}", file);
        return file;
    }

    private static List<Migration> pending(List<Migration> defined, List<AppliedMigration> applied) {
        List<MigrationVersion> appliedVersions = applied.stream()
                .map(a -> MigrationVersion.parse(a.version()))
                .collect(Collectors.toList());
        return defined.stream()
                .filter(m -> !appliedVersions.contains(m.parsedVersion()))
                .collect(Collectors.toList());
    }

    private static List<AppliedMigration> readApplied(Connection conn) throws SQLException {
        List<AppliedMigration> rows = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("select-applied-migrations"))) {
            while (rs.next()) {
                rows.add(new AppliedMigration(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("applied_at"),
                        rs.getString("checksum")));
            }
        }
        rows.sort(Comparator.comparing(a -> MigrationVersion.parse(a.version())));
        return rows;
    }

    static String slug(String description) {
        String slug = description.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
        return slug.isEmpty() ? "migration" : slug;
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null)
            root = root.getCause();
        return root.getMessage();
    }
}
