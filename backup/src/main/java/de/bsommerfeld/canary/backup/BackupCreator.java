package de.bsommerfeld.canary.backup;

import com.google.inject.Inject;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.error.NotFoundException;
import de.bsommerfeld.canary.core.io.DurableFiles;
import de.bsommerfeld.canary.core.io.TarGzWriter;
import de.bsommerfeld.canary.core.util.ByteFormatter;
import de.bsommerfeld.canary.core.util.HashUtil;
import de.bsommerfeld.canary.core.util.Timestamps;
import de.bsommerfeld.canary.db.ConnectionFactory;
import de.bsommerfeld.canary.db.SchemaInspector;
import de.bsommerfeld.canary.db.TableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Produces the backups that verification and restore consume.
 *
 * <p>
 * Database snapshots are taken with {@code VACUUM INTO}, which yields a
 * consistent, defragmented copy even while a collector holds the database
 * open. Every backup gets a {@code sha256sum}-compatible sidecar.
 */
public class BackupCreator {

    private static final Logger LOG = LoggerFactory.getLogger(BackupCreator.class);

    static final String DATABASE_PREFIX = "canary_protocol_";
    static final String BUNDLE_PREFIX = "canary_backup_";

    private final SystemPaths paths;
    private final Clock clock;

    @Inject
    public BackupCreator(SystemPaths paths, Clock clock) {
        this.paths = paths;
        this.clock = clock;
    }

    /**
     * Writes {@code canary_protocol_<ts>.db} and its sidecar into the backup
     * directory.
     *
     * @throws NotFoundException if there is no live database
     */
    public BackupArtifact createDatabaseBackup() throws NotFoundException, IOException {
        requireLiveDatabase();
        Files.createDirectories(paths.backups());
        Path target = DurableFiles.unusedName(paths.backups(), DATABASE_PREFIX + Timestamps.forFileName(clock), ".db");
        snapshot(target);
        HashUtil.writeSidecar(target);
        BackupArtifact artifact = BackupArtifact.of(target);
        LOG.info("[BACKUP] Database backup {} ({})", target.getFileName(), ByteFormatter.format(artifact.sizeBytes()));
        return artifact;
    }

    /**
     * Writes {@code canary_backup_<ts>.tar.gz} holding the database snapshot,
     * configuration and logs below a {@code canary_backup_<ts>/} root, plus
     * a {@code backup_info.txt} manifest and the sidecar.
     *
     * @throws NotFoundException if there is no live database
     */
    public BackupArtifact createFullSystemBackup() throws NotFoundException, IOException {
        requireLiveDatabase();
        Path target = DurableFiles.unusedName(paths.backups(), BUNDLE_PREFIX + Timestamps.forFileName(clock),
                ".tar.gz");
        String fileName = target.getFileName().toString();
        String bundle = fileName.substring(0, fileName.length() - ".tar.gz".length());
        Path snapshot = Files.createTempFile("canary_snapshot_", ".db");
        Files.delete(snapshot);

        try {
            snapshot(snapshot);
            try (TarGzWriter tar = TarGzWriter.open(target)) {
                tar.addDirectory(bundle + "/data");
                tar.addFile(snapshot, bundle + "/data/" + paths.database().getFileName());
                int configFiles = tar.addTree(paths.config(), bundle + "/config");
                int logFiles = tar.addTree(paths.logs(), bundle + "/logs");
                tar.addText(bundle + "/backup_info.txt", manifest(bundle, snapshot, configFiles, logFiles));
                tar.commit();
            }
        } finally {
            Files.deleteIfExists(snapshot);
        }

        HashUtil.writeSidecar(target);
        BackupArtifact artifact = BackupArtifact.of(target);
        LOG.info("[BACKUP] Full system backup {} ({})", target.getFileName(),
                ByteFormatter.format(artifact.sizeBytes()));
        return artifact;
    }

    private void requireLiveDatabase() throws NotFoundException {
        if (!Files.isRegularFile(paths.database())) {
            throw new NotFoundException("No database to back up at " + paths.database());
        }
    }

    private void snapshot(Path target) throws IOException {
        String literal = target.toAbsolutePath().toString().replace("'", "''");
        try (Connection conn = new ConnectionFactory(paths.database()).open();
                Statement stmt = conn.createStatement()) {
            stmt.execute("VACUUM INTO '" + literal + "'");
        } catch (SQLException e) {
            throw new IOException("Snapshot of " + paths.database() + " failed", e);
        }
    }

    private String manifest(String bundle, Path snapshot, int configFiles, int logFiles) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append("Backup Created: ").append(Timestamps.forSql(LocalDateTime.now(clock))).append('\n');
        sb.append("Backup Type: Full System Backup\n");
        sb.append("Contents:\n");
        sb.append("- Database: data/").append(paths.database().getFileName())
                .append(" (").append(ByteFormatter.format(Files.size(snapshot))).append(")\n");
        sb.append("- Configuration files: ").append(configFiles).append('\n');
        sb.append("- Log files: ").append(logFiles).append('\n');
        try (Connection conn = ConnectionFactory.openReadOnly(snapshot)) {
            sb.append("\nTables:\n");
            for (Map.Entry<String, TableInfo> e : SchemaInspector.inspect(conn).entrySet()) {
                sb.append("- ").append(e.getKey()).append(": ").append(e.getValue().rowCount()).append(" rows\n");
            }
        } catch (SQLException e) {
            throw new IOException("Cannot inspect snapshot for manifest", e);
        }
        sb.append("\nTo restore this backup:\n");
        sb.append("canary-lifecycle restore --file ").append(bundle).append(".tar.gz\n");
        return sb.toString();
    }
}
