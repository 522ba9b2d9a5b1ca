package de.bsommerfeld.canary.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.inject.Inject;
import de.bsommerfeld.canary.backup.report.BatchVerificationReport;
import de.bsommerfeld.canary.backup.report.RestorationReport;
import de.bsommerfeld.canary.backup.report.SchemaComparison;
import de.bsommerfeld.canary.backup.report.VerificationHistoryEntry;
import de.bsommerfeld.canary.backup.report.VerificationReport;
import de.bsommerfeld.canary.backup.report.VerificationStatus;
import de.bsommerfeld.canary.core.concurrent.CancellationToken;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.config.VerificationConfig;
import de.bsommerfeld.canary.core.error.NotFoundException;
import de.bsommerfeld.canary.core.event.ApplicationEventBus;
import de.bsommerfeld.canary.core.event.LifecycleEvents.BackupVerifiedEvent;
import de.bsommerfeld.canary.core.io.DurableFiles;
import de.bsommerfeld.canary.core.util.ByteFormatter;
import de.bsommerfeld.canary.core.util.HashUtil;
import de.bsommerfeld.canary.core.util.Json;
import de.bsommerfeld.canary.core.util.Timestamps;
import de.bsommerfeld.canary.db.ColumnInfo;
import de.bsommerfeld.canary.db.ConnectionFactory;
import de.bsommerfeld.canary.db.SchemaInspector;
import de.bsommerfeld.canary.db.SqlLoader;
import de.bsommerfeld.canary.db.TableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks that backups are complete, uncorrupted and restorable.
 *
 * <p>
 * Verification never throws for a bad backup: every failed check is recorded
 * as an error in the returned report, so a batch run can report on all
 * backups of a directory. Backups are only ever opened read-only, and trial
 * restorations work on a temporary copy.
 */
public class BackupIntegrityVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(BackupIntegrityVerifier.class);
    static final String REPORT_PREFIX = "verification_report_";
    private static final Pattern REPORT_NAME = Pattern.compile(
            Pattern.quote(REPORT_PREFIX) + "(\\d{8}_\\d{6})(?:_(\\d{1,9}))?\\.json");

    private final SystemPaths paths;
    private final VerificationConfig config;
    private final Clock clock;
    private final ApplicationEventBus eventBus;
    private final ObjectMapper mapper = Json.newMapper();

    @Inject
    public BackupIntegrityVerifier(SystemPaths paths, VerificationConfig config, Clock clock,
            ApplicationEventBus eventBus) {
        this.paths = paths;
        this.config = config;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public String computeChecksum(Path file) throws IOException {
        return HashUtil.sha256(file);
    }

    /**
     * Reads tables, columns and row counts of a database without modifying
     * it.
     *
     * @throws SQLException if the file is missing or not a database
     */
    public Map<String, TableInfo> inspectSchema(Path dbFile) throws SQLException {
        try (Connection conn = ConnectionFactory.openReadOnly(dbFile)) {
            return SchemaInspector.inspect(conn);
        }
    }

    // =====================================================================
    // Single backup
    // =====================================================================

    public VerificationReport verifyIntegrity(Path backupFile) {
        VerificationReport.Builder report = VerificationReport.builder(
                backupFile.toAbsolutePath().normalize().toString(), LocalDateTime.now(clock));

        if (!Files.isRegularFile(backupFile)) {
            LOG.warn("[VERIFY] Backup {} does not exist", backupFile);
            return report.error("Backup file does not exist").build();
        }
        report.fileExists(true);

        try {
            report.fileSizeBytes(Files.size(backupFile));
            String actual = computeChecksum(backupFile);
            report.checksum(actual);
            Path sidecar = HashUtil.sidecarOf(backupFile);
            if (Files.exists(sidecar)) {
                String expected = HashUtil.readSidecar(sidecar);
                report.expectedChecksum(expected);
                if (expected != null && !expected.equals(actual)) {
                    report.error("Checksum mismatch: sidecar expects " + expected + " but file hashes to " + actual);
                }
            }
        } catch (IOException e) {
            LOG.error("[VERIFY] Cannot read {}", backupFile, e);
            return report.error("Backup file not readable: " + e.getMessage()).build();
        }

        Map<String, TableInfo> backupSchema;
        try (Connection conn = ConnectionFactory.openReadOnly(backupFile)) {
            backupSchema = SchemaInspector.inspect(conn);
            report.databaseReadable(true).tableCount(backupSchema.size());
            String quickCheck = quickCheck(conn);
            if (!"ok".equalsIgnoreCase(quickCheck)) {
                report.error("Integrity check failed: " + quickCheck);
            }
        } catch (SQLException e) {
            LOG.warn("[VERIFY] {} is not a readable database: {}", backupFile.getFileName(), e.getMessage());
            return report.error("Database not readable: " + e.getMessage()).build();
        }

        try {
            compareSchemas(liveSchema(), backupSchema, report);
        } catch (SQLException e) {
            LOG.error("[VERIFY] Schema comparison failed for {}", backupFile, e);
            report.error("Schema verification failed: " + e.getMessage());
        }

        try {
            report.dataSampleValid(verifyDataSample(backupFile));
        } catch (SQLException e) {
            LOG.error("[VERIFY] Data sample check failed for {}", backupFile, e);
            report.error("Data sample verification failed: " + e.getMessage());
        }

        VerificationReport result = report.build();
        LOG.info("[VERIFY] {}: {}", backupFile.getFileName(), result.overallValid() ? "valid" : result.errors());
        return result;
    }

    private static String quickCheck(Connection conn) throws SQLException {
        List<String> problems = new ArrayList<>();
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("PRAGMA quick_check")) {
            while (rs.next()) {
                problems.add(rs.getString(1));
            }
        }
        return String.join("; ", problems);
    }

    /** The live schema, or an empty one if there is no live database yet. */
    private Map<String, TableInfo> liveSchema() throws SQLException {
        if (!Files.exists(paths.database())) {
            LOG.warn("[VERIFY] Live database {} does not exist, skipping schema comparison", paths.database());
            return Map.of();
        }
        return inspectSchema(paths.database());
    }

    private static void compareSchemas(Map<String, TableInfo> live, Map<String, TableInfo> backup,
            VerificationReport.Builder report) {
        boolean matches = true;
        int matching = 0;
        for (TableInfo liveTable : live.values()) {
            TableInfo backupTable = backup.get(liveTable.name());
            if (backupTable == null) {
                matches = false;
                report.error("Missing table in backup: " + liveTable.name());
                continue;
            }
            matching++;
            if (!sameColumns(liveTable.columns(), backupTable.columns())) {
                matches = false;
                report.error("Schema mismatch in table: " + liveTable.name());
            }
        }
        report.schemaValid(matches)
                .schemaComparison(new SchemaComparison(live.size(), backup.size(), matching));
    }

    private static boolean sameColumns(List<ColumnInfo> a, List<ColumnInfo> b) {
        Comparator<ColumnInfo> byName = Comparator.comparing(ColumnInfo::name);
        return a.stream().sorted(byName).collect(Collectors.toList())
                .equals(b.stream().sorted(byName).collect(Collectors.toList()));
    }

    /**
     * Samples rows of the critical tables and checks their NOT NULL columns.
     * Tables missing from the backup are tolerated.
     *
     * @return {@code false} if a sampled row holds a null in a NOT NULL column
     * @throws SQLException if the backup cannot be opened
     */
    public boolean verifyDataSample(Path backupFile) throws SQLException {
        try (Connection conn = ConnectionFactory.openReadOnly(backupFile)) {
            for (String table : config.getCriticalTables()) {
                if (!SchemaInspector.tableExists(conn, table)) {
                    LOG.debug("[VERIFY] Critical table {} not present, skipped", table);
                    continue;
                }
                List<String> required = SchemaInspector.columns(conn, table).stream()
                        .filter(ColumnInfo::notNull)
                        .map(ColumnInfo::name)
                        .collect(Collectors.toList());
                if (required.isEmpty())
                    continue;

                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT * FROM " + SchemaInspector.quote(table) + " LIMIT ?")) {
                    ps.setInt(1, config.getSampleSize());
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            for (String column : required) {
                                if (rs.getObject(column) == null) {
                                    LOG.warn("[VERIFY] Null in NOT NULL column {}.{}", table, column);
                                    return false;
                                }
                            }
                        }
                    }
                }
            }
        }
        return true;
    }

    /**
     * Restores the backup into a temporary copy, verifies the copy and runs
     * probe queries against it. The copy is deleted on every exit path.
     */
    public RestorationReport testRestoration(Path backupFile) {
        String name = backupFile.toAbsolutePath().normalize().toString();
        LocalDateTime testedAt = LocalDateTime.now(clock);
        List<String> errors = new ArrayList<>();

        if (!Files.isRegularFile(backupFile)) {
            errors.add("Backup file does not exist");
            return new RestorationReport(name, testedAt, false, false, null, RestorationReport.Timings.NONE, errors);
        }

        Path copy = null;
        try {
            copy = Files.createTempFile("canary_restore_test_", ".db");
            Stopwatch total = Stopwatch.createStarted();
            Files.copy(backupFile, copy, StandardCopyOption.REPLACE_EXISTING);
            double copySeconds = seconds(total);

            Stopwatch verification = Stopwatch.createStarted();
            VerificationReport verified = verifyIntegrity(copy);
            errors.addAll(verified.errors());

            RestorationReport.OperationProbe probe = null;
            try {
                probe = probe(copy);
            } catch (SQLException e) {
                LOG.warn("[VERIFY] Probe queries failed on restored copy of {}: {}", backupFile.getFileName(),
                        e.getMessage());
                errors.add("Operation test failed: " + e.getMessage());
            }

            RestorationReport.Timings timings = new RestorationReport.Timings(
                    copySeconds, seconds(verification), seconds(total));
            return new RestorationReport(name, testedAt, verified.overallValid(), verified.dataSampleValid(),
                    probe, timings, errors);
        } catch (IOException e) {
            LOG.error("[VERIFY] Restoration test of {} failed", backupFile, e);
            errors.add("Restoration test failed: " + e.getMessage());
            return new RestorationReport(name, testedAt, false, false, null, RestorationReport.Timings.NONE, errors);
        } finally {
            deleteTemp(copy);
        }
    }

    private static RestorationReport.OperationProbe probe(Path db) throws SQLException {
        try (Connection conn = ConnectionFactory.openReadOnly(db); Statement stmt = conn.createStatement()) {
            int tables;
            try (ResultSet rs = stmt.executeQuery(SqlLoader.load("select-table-count"))) {
                tables = rs.next() ? rs.getInt(1) : 0;
            }
            try (ResultSet rs = stmt.executeQuery(SqlLoader.load("restoration-probe"))) {
                return new RestorationReport.OperationProbe(tables, rs.next() ? rs.getLong(1) : 0);
            }
        }
    }

    private static void deleteTemp(Path copy) {
        if (copy == null)
            return;
        try {
            Files.deleteIfExists(copy);
        } catch (IOException e) {
            LOG.warn("[VERIFY] Failed to clean up temporary copy {}", copy, e);
        }
    }

    private static double seconds(Stopwatch stopwatch) {
        return stopwatch.elapsed(TimeUnit.MICROSECONDS) / 1_000_000.0;
    }

    // =====================================================================
    // Batch
    // =====================================================================

    /**
     * Verifies every recent backup of {@code directory} and persists the
     * aggregate report. A failing backup never aborts the run.
     *
     * @throws NotFoundException if the directory does not exist or holds no
     *                           backups
     * @throws IOException       if the directory cannot be listed or the
     *                           report cannot be written
     */
    public BatchVerificationReport runBatchVerification(Path directory, CancellationToken cancellation)
            throws NotFoundException, IOException {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        if (!Files.isDirectory(directory)) {
            throw new NotFoundException("Backup directory does not exist: " + directory);
        }
        List<BackupArtifact> found = BackupDiscovery.discover(directory, config.getExtensions());
        if (found.isEmpty()) {
            throw new NotFoundException("No backup files found in " + directory);
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(config.getMaxBackupAgeDays()));
        List<BackupArtifact> recent = found.stream()
                .filter(a -> a.modifiedAt().isAfter(cutoff))
                .collect(Collectors.toList());
        LOG.info("[VERIFY] Found {} recent backups to verify ({} total)", recent.size(), found.size());

        List<BatchVerificationReport.Item> items = new ArrayList<>();
        int verified = 0;
        int failed = 0;
        boolean cancelled = false;

        for (BackupArtifact artifact : recent) {
            if (cancellation.isCancelled()) {
                LOG.warn("[VERIFY] Batch cancelled after {} of {} backups", items.size(), recent.size());
                cancelled = true;
                break;
            }
            BatchVerificationReport.Item item = verifyItem(artifact);
            items.add(item);
            if (item.overallStatus() == VerificationStatus.PASS) {
                verified++;
            } else {
                failed++;
            }
            int errorCount = item.integrityCheck() == null ? 1 : item.integrityCheck().errors().size();
            eventBus.post(new BackupVerifiedEvent(artifact.file(), item.overallStatus().name(), errorCount));
        }

        List<Long> passingAges = items.stream()
                .filter(i -> i.overallStatus() == VerificationStatus.PASS)
                .map(BatchVerificationReport.Item::backupAgeDays)
                .collect(Collectors.toList());
        long totalBytes = recent.stream().mapToLong(BackupArtifact::sizeBytes).sum();
        BatchVerificationReport.Summary summary = new BatchVerificationReport.Summary(
                recent.isEmpty() ? 0 : verified * 100.0 / recent.size(),
                passingAges.stream().max(Long::compare).orElse(null),
                passingAges.stream().min(Long::compare).orElse(null),
                ByteFormatter.toMegabytes(totalBytes));

        BatchVerificationReport report = new BatchVerificationReport(startedAt, LocalDateTime.now(clock),
                directory.toAbsolutePath().normalize().toString(), found.size(), verified, failed, items, summary,
                cancelled);

        Path reportFile = Json.writeNew(mapper, report,
                DurableFiles.unusedName(paths.reports(), REPORT_PREFIX + Timestamps.forFileName(clock), ".json"));
        LOG.info("[VERIFY] {}/{} backups verified, report saved to {}", verified, recent.size(), reportFile);
        return report;
    }

    private BatchVerificationReport.Item verifyItem(BackupArtifact artifact) {
        String file = artifact.file().toString();
        long age = artifact.ageDays(clock);
        try {
            LOG.info("[VERIFY] Verifying backup {}", artifact.fileName());
            VerificationReport integrity = verifyIntegrity(artifact.file());
            RestorationReport restoration = artifact.type() == BackupType.DATABASE
                    ? testRestoration(artifact.file())
                    : null;
            boolean pass = integrity.overallValid() && (restoration == null || restoration.restorationSuccessful());
            return new BatchVerificationReport.Item(file, age, pass ? VerificationStatus.PASS : VerificationStatus.FAIL,
                    integrity, restoration, null);
        } catch (RuntimeException e) {
            LOG.error("[VERIFY] Failed to verify backup {}", artifact.file(), e);
            return new BatchVerificationReport.Item(file, age, VerificationStatus.ERROR, null, null,
                    String.valueOf(e.getMessage()));
        }
    }

    // =====================================================================
    // History
    // =====================================================================

    /** Persisted batch reports written within the last {@code days} days, oldest first. */
    public List<VerificationHistoryEntry> getVerificationHistory(int days) throws IOException {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        List<VerificationHistoryEntry> history = new ArrayList<>();
        for (Path file : reportFiles()) {
            if (!Files.getLastModifiedTime(file).toInstant().isAfter(cutoff))
                continue;
            readReport(file).ifPresent(node -> history.add(new VerificationHistoryEntry(
                    file,
                    node.path("started_at").asText(),
                    node.path("backups_found").asInt(),
                    node.path("backups_verified").asInt(),
                    node.path("backups_failed").asInt(),
                    node.path("cancelled").asBoolean())));
        }
        return history;
    }

    /**
     * Most recent batch status of the given backup across persisted reports.
     */
    public Optional<VerificationStatus> lastKnownStatus(Path backupFile) throws IOException {
        String wanted = backupFile.toAbsolutePath().normalize().toString();
        List<Path> files = reportFiles();
        for (int i = files.size() - 1; i >= 0; i--) {
            Optional<JsonNode> report = readReport(files.get(i));
            if (report.isEmpty())
                continue;
            for (JsonNode item : report.get().path("verification_results")) {
                if (wanted.equals(item.path("backup_file").asText())) {
                    return Optional.of(VerificationStatus.valueOf(item.path("overall_status").asText("ERROR")));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Report files in chronological order: by timestamp, then by the
     * {@code _<n>} suffix of reports written within the same second.
     */
    private List<Path> reportFiles() throws IOException {
        if (!Files.isDirectory(paths.reports()))
            return List.of();
        try (Stream<Path> stream = Files.list(paths.reports())) {
            return stream.filter(p -> {
                String n = p.getFileName().toString();
                return n.startsWith(REPORT_PREFIX) && n.endsWith(".json");
            }).sorted(Comparator.comparing(BackupIntegrityVerifier::reportOrderKey)).collect(Collectors.toList());
        }
    }

    static String reportOrderKey(Path file) {
        String name = file.getFileName().toString();
        Matcher m = REPORT_NAME.matcher(name);
        if (!m.matches())
            return name;
        return m.group(1) + String.format(Locale.ROOT, "_%09d", m.group(2) == null ? 0 : Integer.parseInt(m.group(2)));
    }

    private Optional<JsonNode> readReport(Path file) {
        try {
            return Optional.of(mapper.readTree(file.toFile()));
        } catch (IOException e) {
            LOG.warn("[VERIFY] Skipping unreadable verification report {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
}
