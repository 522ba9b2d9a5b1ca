package de.bsommerfeld.canary.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import de.bsommerfeld.canary.core.concurrent.CancellationToken;
import de.bsommerfeld.canary.core.concurrent.DatabaseLock;
import de.bsommerfeld.canary.core.config.ArchivalConfig;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.error.DataAccessException;
import de.bsommerfeld.canary.core.error.LifecycleException;
import de.bsommerfeld.canary.core.error.NotFoundException;
import de.bsommerfeld.canary.core.error.UnsupportedFormatException;
import de.bsommerfeld.canary.core.event.ApplicationEventBus;
import de.bsommerfeld.canary.core.event.LifecycleEvents.ArchiveItemCompletedEvent;
import de.bsommerfeld.canary.core.io.DurableFiles;
import de.bsommerfeld.canary.core.io.TarGzWriter;
import de.bsommerfeld.canary.core.util.ByteFormatter;
import de.bsommerfeld.canary.core.util.Json;
import de.bsommerfeld.canary.core.util.Timestamps;
import de.bsommerfeld.canary.db.ColumnInfo;
import de.bsommerfeld.canary.db.SchemaInspector;
import de.bsommerfeld.canary.db.SqlLoader;
import de.bsommerfeld.canary.db.TableInfo;
import de.bsommerfeld.canary.db.Transactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Moves rows past their retention window out of the live database into
 * compressed archive files, and puts them back on request.
 *
 * <p>
 * Archiving a table is all-or-nothing: the archive file is fsynced and
 * renamed into place before any row is deleted, and the deletion, the audit
 * row and the commit happen in the same transaction. A failure at any point
 * leaves every row in the live table and no archive file behind.
 *
 * <p>
 * Cutoffs are computed in UTC from the injected {@link Clock} and compared
 * with SQLite's {@code datetime()}, so rows whose date column is NULL or not
 * parseable are never archived.
 */
public class DataArchivalManager {

    private static final Logger LOG = LoggerFactory.getLogger(DataArchivalManager.class);

    public static final String LOGS_ITEM = "logs";
    static final String LOG_BUNDLE_PREFIX = "logs_";
    static final String REPORT_PREFIX = "archival_report_";
    static final String SNAPSHOT_SUFFIX = ".json.gz";
    static final String ROWID = "rowid";

    private final Transactor transactor;
    private final SystemPaths paths;
    private final ArchivalConfig config;
    private final DatabaseLock lock;
    private final Clock clock;
    private final ApplicationEventBus eventBus;
    private final SnapshotCodec codec = new SnapshotCodec();
    private final ObjectMapper mapper = Json.newMapper();

    @Inject
    public DataArchivalManager(Transactor transactor, SystemPaths paths, ArchivalConfig config, DatabaseLock lock,
            Clock clock, ApplicationEventBus eventBus) {
        this.transactor = transactor;
        this.paths = paths;
        this.config = config;
        this.lock = lock;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    // =====================================================================
    // Policies and candidates
    // =====================================================================

    /**
     * Returns the configured retention for {@code table}, or the log
     * retention for {@link #LOGS_ITEM}.
     *
     * @throws NotFoundException if no policy is configured for the table
     */
    public RetentionPolicy retentionPolicy(String table) throws NotFoundException {
        if (LOGS_ITEM.equals(table)) {
            return new RetentionPolicy(LOGS_ITEM, null, config.getLogRetentionDays());
        }
        return config.getTables().stream()
                .filter(p -> p.getTable().equals(table))
                .findFirst()
                .map(RetentionPolicy::from)
                .orElseThrow(() -> new NotFoundException("No retention policy configured for table " + table));
    }

    /** UTC cutoff for a retention window, in SQLite {@code datetime()} format. */
    public String cutoff(int retentionDays) {
        return Timestamps.forSql(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(retentionDays));
    }

    /**
     * Rows of {@code table} whose {@code dateColumn} lies before the table's
     * retention cutoff, oldest first.
     */
    public List<Map<String, Object>> findCandidates(String table, String dateColumn) throws NotFoundException {
        RetentionPolicy policy = retentionPolicy(table);
        TableInfo info = describe(table, dateColumn);
        String cutoff = cutoff(policy.retentionDays());
        return transactor.withConnection(conn -> selectCandidates(conn, info, dateColumn, cutoff));
    }

    /** Candidate counts for every configured table; nothing is modified. */
    public List<CandidateCount> dryRun() {
        List<CandidateCount> counts = new ArrayList<>();
        for (ArchivalConfig.TablePolicy configured : config.getTables()) {
            RetentionPolicy policy = RetentionPolicy.from(configured);
            String cutoff = cutoff(policy.retentionDays());
            try {
                TableInfo info = describe(policy.table(), policy.dateColumn());
                long candidates = transactor.withConnection(conn -> countCandidates(conn, info, policy.dateColumn(), cutoff));
                counts.add(new CandidateCount(policy.table(), policy.dateColumn(), policy.retentionDays(), cutoff,
                        candidates, null));
            } catch (NotFoundException | DataAccessException e) {
                LOG.warn("[ARCHIVE] Dry run skipped {}: {}", policy.table(), e.getMessage());
                counts.add(new CandidateCount(policy.table(), policy.dateColumn(), policy.retentionDays(), cutoff,
                        0, e.getMessage()));
            }
        }
        return counts;
    }

    // =====================================================================
    // Archival
    // =====================================================================

    /**
     * Archives every row of {@code table} past its retention window into
     * {@code <table>_<yyyyMMdd_HHmmss>.json.gz} and deletes those rows. An
     * existing archive is never replaced; a second run within the same second
     * writes {@code <table>_<yyyyMMdd_HHmmss>_1.json.gz}.
     *
     * @throws NotFoundException if the table, its date column or its policy is
     *                           unknown
     * @throws IOException       if the archive cannot be written or the lock
     *                           not acquired; no row has been deleted then
     */
    public ArchiveResult archiveTable(String table) throws NotFoundException, IOException {
        RetentionPolicy policy = retentionPolicy(table);
        String cutoff = cutoff(policy.retentionDays());

        try (DatabaseLock.Handle ignored = lock.acquire("archive " + table)) {
            TableInfo info = describe(table, policy.dateColumn());
            Path[] written = new Path[1];
            try {
                ArchiveResult result = transactor.inTransaction(conn -> {
                    List<Map<String, Object>> rows = selectCandidates(conn, info, policy.dateColumn(), cutoff);
                    if (rows.isEmpty()) {
                        return ArchiveResult.nothing(table, cutoff);
                    }

                    Path target = DurableFiles.unusedName(paths.archives(),
                            table + "_" + Timestamps.forFileName(clock), SNAPSHOT_SUFFIX);
                    written[0] = codec.write(target, snapshotOf(info, policy, cutoff, rows));

                    deleteRows(conn, table, keyColumns(info), rows);
                    insertHistory(conn, policy, cutoff, rows.size(), target);
                    return new ArchiveResult(table, rows.size(), target, cutoff);
                });
                if (result.archivedAnything()) {
                    LOG.info("[ARCHIVE] Archived {} rows of {} older than {} to {}",
                            result.archivedCount(), table, cutoff, result.archiveFile().getFileName());
                } else {
                    LOG.info("[ARCHIVE] Nothing to archive in {} (cutoff {})", table, cutoff);
                }
                return result;
            } catch (IOException | RuntimeException e) {
                discardOrphan(written[0], e);
                throw e;
            }
        }
    }

    /**
     * Bundles log files older than the log retention window into
     * {@code logs_<yyyyMMdd_HHmmss>.tar.gz} (suffixed {@code _<n>} if that
     * name is taken), then deletes the originals.
     */
    public ArchiveResult archiveLogs() throws IOException {
        Instant threshold = clock.instant().minus(Duration.ofDays(config.getLogRetentionDays()));
        String cutoff = Timestamps.forSql(LocalDateTime.ofInstant(threshold, ZoneOffset.UTC));
        Path logs = paths.logs();
        if (!Files.isDirectory(logs)) {
            return ArchiveResult.nothing(LOGS_ITEM, cutoff);
        }

        List<Path> expired = new ArrayList<>();
        try (Stream<Path> files = Files.list(logs)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().collect(Collectors.toList())) {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(threshold)) {
                    expired.add(file);
                }
            }
        }
        if (expired.isEmpty()) {
            LOG.info("[ARCHIVE] No log files older than {}", cutoff);
            return ArchiveResult.nothing(LOGS_ITEM, cutoff);
        }

        Path target = DurableFiles.unusedName(paths.archives(),
                LOG_BUNDLE_PREFIX + Timestamps.forFileName(clock), ".tar.gz");
        try (TarGzWriter writer = TarGzWriter.open(target)) {
            for (Path file : expired) {
                writer.addFile(file, "logs/" + file.getFileName());
            }
            writer.commit();
        }

        int deleted = 0;
        for (Path file : expired) {
            try {
                Files.deleteIfExists(file);
                deleted++;
            } catch (IOException e) {
                LOG.warn("[ARCHIVE] Archived log {} could not be removed: {}", file.getFileName(), e.getMessage());
            }
        }
        LOG.info("[ARCHIVE] Bundled {} log files into {} ({} removed)", expired.size(), target.getFileName(), deleted);
        return new ArchiveResult(LOGS_ITEM, expired.size(), target, cutoff);
    }

    /**
     * Archives every configured table in order, then the logs. A failing item
     * is recorded in the report and does not stop the run; cancellation is
     * honoured between items.
     */
    public ArchivalReport runFullArchival(CancellationToken cancellation) throws IOException {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        List<ArchivalReport.Item> items = new ArrayList<>();
        boolean cancelled = false;

        List<String> order = config.getTables().stream()
                .map(ArchivalConfig.TablePolicy::getTable)
                .collect(Collectors.toCollection(ArrayList::new));
        order.add(LOGS_ITEM);

        for (String item : order) {
            if (cancellation.isCancelled()) {
                LOG.warn("[ARCHIVE] Archival cancelled before {}", item);
                cancelled = true;
                break;
            }
            items.add(runItem(item));
        }

        int total = items.stream().mapToInt(ArchivalReport.Item::archived).sum();
        int failed = (int) items.stream().filter(i -> i.error() != null).count();
        ArchivalReport report = new ArchivalReport(startedAt, LocalDateTime.now(clock), items, total, failed,
                cancelled);

        Path reportFile = Json.writeNew(mapper, report,
                DurableFiles.unusedName(paths.archives(), REPORT_PREFIX + Timestamps.forFileName(clock), ".json"));
        LOG.info("[ARCHIVE] Archival finished: {} records, {} failed items, report {}", total, failed,
                reportFile.getFileName());
        return report;
    }

    private ArchivalReport.Item runItem(String item) {
        ArchivalReport.Item result;
        try {
            ArchiveResult archived = LOGS_ITEM.equals(item) ? archiveLogs() : archiveTable(item);
            result = new ArchivalReport.Item(item, archived.archivedCount(),
                    archived.archiveFile() == null ? null : archived.archiveFile().toString(), archived.cutoff(), null);
        } catch (LifecycleException | IOException | RuntimeException e) {
            LOG.error("[ARCHIVE] Archiving {} failed: {}", item, e.getMessage(), e);
            result = new ArchivalReport.Item(item, 0, null, null, e.getMessage());
        }
        eventBus.post(new ArchiveItemCompletedEvent(result.item(), result.archived(),
                result.archiveFile() == null ? null : Path.of(result.archiveFile()), result.error()));
        return result;
    }

    // =====================================================================
    // Restore
    // =====================================================================

    /**
     * Re-inserts the rows of a table snapshot into their original table in a
     * single transaction. Rows whose primary key already exists are skipped.
     *
     * @throws NotFoundException          if the file or the target table does
     *                                    not exist
     * @throws UnsupportedFormatException if the file is not a table snapshot
     */
    public ArchiveRestoreResult restoreFromArchive(Path archiveFile) throws LifecycleException, IOException {
        if (!Files.isRegularFile(archiveFile)) {
            throw new NotFoundException("Archive file not found: " + archiveFile);
        }
        if (ArchiveKind.infer(archiveFile) != ArchiveKind.TABLE_SNAPSHOT) {
            throw new UnsupportedFormatException("Only table snapshots (*" + SNAPSHOT_SUFFIX
                    + ") can be restored: " + archiveFile.getFileName());
        }
        TableSnapshot snapshot = codec.read(archiveFile);

        try (DatabaseLock.Handle ignored = lock.acquire("restore archive " + archiveFile.getFileName())) {
            TableInfo info = transactor.withConnection(conn -> SchemaInspector.describe(conn, snapshot.table()))
                    .orElseThrow(() -> new NotFoundException("Table " + snapshot.table() + " does not exist"));
            ArchiveRestoreResult result = transactor.inTransaction(conn -> insertMissing(conn, info, snapshot, archiveFile));
            LOG.info("[ARCHIVE] Restored {} rows into {} from {} ({} already present)",
                    result.restored(), result.table(), archiveFile.getFileName(), result.skipped());
            return result;
        }
    }

    // =====================================================================
    // Inventory
    // =====================================================================

    public ArchiveSummary getArchiveSummary() throws IOException {
        Map<ArchiveKind, ArchiveSummary.KindTotals> byType = new EnumMap<>(ArchiveKind.class);
        int totalFiles = 0;
        long totalBytes = 0;
        Instant oldest = null;
        Instant newest = null;

        Path dir = paths.archives();
        if (Files.isDirectory(dir)) {
            List<Path> files;
            try (Stream<Path> listing = Files.list(dir)) {
                files = listing.filter(Files::isRegularFile)
                        .filter(f -> !f.getFileName().toString().startsWith(REPORT_PREFIX))
                        .filter(f -> !f.getFileName().toString().endsWith(".tmp"))
                        .collect(Collectors.toList());
            }
            for (Path file : files) {
                long size = Files.size(file);
                Instant modified = Files.getLastModifiedTime(file).toInstant();
                byType.merge(ArchiveKind.infer(file), new ArchiveSummary.KindTotals(1, size),
                        (a, b) -> new ArchiveSummary.KindTotals(a.files() + b.files(), a.bytes() + b.bytes()));
                totalFiles++;
                totalBytes += size;
                oldest = oldest == null || modified.isBefore(oldest) ? modified : oldest;
                newest = newest == null || modified.isAfter(newest) ? modified : newest;
            }
        }
        return new ArchiveSummary(byType, totalFiles, totalBytes, ByteFormatter.toMegabytes(totalBytes), oldest,
                newest);
    }

    /** Most recent archival audit rows first; empty before the first archival. */
    public List<ArchivalRecord> getArchiveHistory(int limit) {
        return transactor.withConnection(conn -> {
            if (!SchemaInspector.tableExists(conn, "archive_history")) {
                return Collections.<ArchivalRecord>emptyList();
            }
            List<ArchivalRecord> records = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-archive-history"))) {
                ps.setInt(1, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        records.add(new ArchivalRecord(
                                rs.getLong("id"),
                                rs.getString("table_name"),
                                rs.getString("date_column"),
                                rs.getInt("retention_days"),
                                rs.getString("cutoff"),
                                rs.getInt("archived_count"),
                                rs.getString("archive_file"),
                                rs.getString("created_at")));
                    }
                }
            }
            return records;
        });
    }

    // =====================================================================
    // SQL helpers
    // =====================================================================

    private TableInfo describe(String table, String dateColumn) throws NotFoundException {
        Optional<TableInfo> info = transactor.withConnection(conn -> SchemaInspector.describe(conn, table));
        if (info.isEmpty()) {
            throw new NotFoundException("Table " + table + " does not exist");
        }
        if (!info.get().hasColumn(dateColumn)) {
            throw new NotFoundException("Table " + table + " has no column " + dateColumn);
        }
        return info.get();
    }

    private static List<String> keyColumns(TableInfo info) {
        List<String> key = info.primaryKey();
        return key.isEmpty() ? List.of(ROWID) : key;
    }

    private static String keyExpression(String column) {
        return ROWID.equals(column) ? ROWID : SchemaInspector.quote(column);
    }

    private static List<Map<String, Object>> selectCandidates(Connection conn, TableInfo info, String dateColumn,
            String cutoff) throws SQLException {
        String projection = info.primaryKey().isEmpty() ? ROWID + " AS " + ROWID + ", *" : "*";
        String date = SchemaInspector.quote(dateColumn);
        String sql = "SELECT " + projection + " FROM " + SchemaInspector.quote(info.name())
                + " WHERE datetime(" + date + ") < datetime(?) ORDER BY datetime(" + date + "), rowid";

        List<Map<String, Object>> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, cutoff);
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        row.put(meta.getColumnLabel(i), rs.getObject(i));
                    }
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    private static long countCandidates(Connection conn, TableInfo info, String dateColumn, String cutoff)
            throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + SchemaInspector.quote(info.name())
                + " WHERE datetime(" + SchemaInspector.quote(dateColumn) + ") < datetime(?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, cutoff);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    private TableSnapshot snapshotOf(TableInfo info, RetentionPolicy policy, String cutoff,
            List<Map<String, Object>> rows) {
        Map<String, String> columnTypes = new LinkedHashMap<>();
        for (ColumnInfo column : info.columns()) {
            columnTypes.put(column.name(), column.type());
        }
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> encoded = new LinkedHashMap<>();
            row.forEach((column, value) -> encoded.put(column, SnapshotCodec.encode(value)));
            records.add(encoded);
        }
        String archivedAt = Timestamps.forSql(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        return new TableSnapshot(info.name(), policy.dateColumn(), policy.retentionDays(), cutoff, archivedAt,
                rows.size(), keyColumns(info), columnTypes, records);
    }

    private static void deleteRows(Connection conn, String table, List<String> key, List<Map<String, Object>> rows)
            throws SQLException {
        String where = key.stream().map(c -> keyExpression(c) + " = ?").collect(Collectors.joining(" AND "));
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM " + SchemaInspector.quote(table) + " WHERE " + where)) {
            for (Map<String, Object> row : rows) {
                for (int i = 0; i < key.size(); i++) {
                    ps.setObject(i + 1, row.get(key.get(i)));
                }
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertHistory(Connection conn, RetentionPolicy policy, String cutoff, int count, Path archiveFile)
            throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(SqlLoader.load("create-archive-history"));
        }
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-archive-history"))) {
            ps.setString(1, policy.table());
            ps.setString(2, policy.dateColumn());
            ps.setInt(3, policy.retentionDays());
            ps.setString(4, cutoff);
            ps.setInt(5, count);
            ps.setString(6, archiveFile.toString());
            ps.setString(7, Timestamps.forSql(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC)));
            ps.executeUpdate();
        }
    }

    private static ArchiveRestoreResult insertMissing(Connection conn, TableInfo info, TableSnapshot snapshot,
            Path archiveFile) throws SQLException {
        List<String> columns = new ArrayList<>();
        if (snapshot.keyedByRowid()) {
            columns.add(ROWID);
        }
        for (String column : snapshot.columnTypes().keySet()) {
            if (info.hasColumn(column)) {
                columns.add(column);
            } else {
                LOG.warn("[ARCHIVE] Column {}.{} no longer exists; its archived values are dropped",
                        snapshot.table(), column);
            }
        }

        List<String> key = snapshot.primaryKey();
        String table = SchemaInspector.quote(snapshot.table());
        String exists = key.isEmpty() ? null
                : "SELECT 1 FROM " + table + " WHERE "
                        + key.stream().map(c -> keyExpression(c) + " = ?").collect(Collectors.joining(" AND "));
        String insert = "INSERT INTO " + table + " ("
                + columns.stream().map(DataArchivalManager::keyExpression).collect(Collectors.joining(", "))
                + ") VALUES (" + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";

        int restored = 0;
        int skipped = 0;
        try (PreparedStatement insertPs = conn.prepareStatement(insert);
                PreparedStatement existsPs = exists == null ? null : conn.prepareStatement(exists)) {
            for (Map<String, Object> record : snapshot.records()) {
                if (existsPs != null && keyExists(existsPs, key, record)) {
                    skipped++;
                    continue;
                }
                for (int i = 0; i < columns.size(); i++) {
                    insertPs.setObject(i + 1, record.get(columns.get(i)));
                }
                insertPs.executeUpdate();
                restored++;
            }
        }
        return new ArchiveRestoreResult(archiveFile, snapshot.table(), restored, skipped);
    }

    private static boolean keyExists(PreparedStatement ps, List<String> key, Map<String, Object> record)
            throws SQLException {
        for (String column : key) {
            if (record.get(column) == null) {
                return false;
            }
        }
        for (int i = 0; i < key.size(); i++) {
            ps.setObject(i + 1, record.get(key.get(i)));
        }
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next();
        }
    }

    private static void discardOrphan(Path archive, Exception cause) {
        if (archive == null) {
            return;
        }
        try {
            Files.deleteIfExists(archive);
            LOG.warn("[ARCHIVE] Removed {} after failed archival; live rows are unchanged", archive.getFileName());
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
