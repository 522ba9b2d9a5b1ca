package de.bsommerfeld.canary.restore;

import com.google.inject.Inject;
import de.bsommerfeld.canary.backup.BackupArtifact;
import de.bsommerfeld.canary.backup.BackupDiscovery;
import de.bsommerfeld.canary.backup.BackupIntegrityVerifier;
import de.bsommerfeld.canary.backup.BackupType;
import de.bsommerfeld.canary.backup.report.VerificationReport;
import de.bsommerfeld.canary.backup.report.VerificationStatus;
import de.bsommerfeld.canary.core.concurrent.DatabaseLock;
import de.bsommerfeld.canary.core.config.RestoreConfig;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.error.ConfirmationDeclinedException;
import de.bsommerfeld.canary.core.error.IntegrityFailureException;
import de.bsommerfeld.canary.core.error.LifecycleException;
import de.bsommerfeld.canary.core.error.NotFoundException;
import de.bsommerfeld.canary.core.error.UnsupportedFormatException;
import de.bsommerfeld.canary.core.event.ApplicationEventBus;
import de.bsommerfeld.canary.core.event.LifecycleEvents.RestoreCompletedEvent;
import de.bsommerfeld.canary.core.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Restores the live database, or the whole data/config/logs tree, from a
 * backup.
 *
 * <p>
 * Every attempt asks for confirmation first and ends with exactly one
 * {@code restore_history} row, whether it succeeded, failed or was declined.
 * Before anything live is overwritten a safety copy of the current database
 * is taken, and the replacement itself is a staged copy renamed over the
 * target, so the live file is always either the old or the new database.
 */
public class RestoreCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(RestoreCoordinator.class);

    /** Extensions offered for restore; only database files and full-system bundles are restorable. */
    public static final List<String> SUPPORTED_EXTENSIONS = List.of(".db", ".json", ".tar.gz", ".sql", ".zip");

    static final String SAFETY_BACKUP_INFIX = ".safety_backup.";
    private static final List<String> SQLITE_SIDE_FILES = List.of("-journal", "-wal", "-shm");

    private final SystemPaths paths;
    private final RestoreConfig config;
    private final BackupIntegrityVerifier verifier;
    private final RestoreHistoryRepository history;
    private final DatabaseLock lock;
    private final Clock clock;
    private final ApplicationEventBus eventBus;

    @Inject
    public RestoreCoordinator(SystemPaths paths, RestoreConfig config, BackupIntegrityVerifier verifier,
            RestoreHistoryRepository history, DatabaseLock lock, Clock clock, ApplicationEventBus eventBus) {
        this.paths = paths;
        this.config = config;
        this.verifier = verifier;
        this.history = history;
        this.lock = lock;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    /** Backups in {@code directory} with a restorable-looking extension, newest first. */
    public List<BackupArtifact> listAvailableBackups(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            LOG.warn("[RESTORE] Backup directory {} does not exist", directory);
            return List.of();
        }
        return BackupDiscovery.discover(directory, SUPPORTED_EXTENSIONS);
    }

    /**
     * Copies {@code target} to {@code <target>.safety_backup.<yyyyMMdd_HHmmss>}.
     *
     * @return the copy, or {@code null} if {@code target} does not exist
     */
    public Path createSafetyBackup(Path target) throws IOException {
        if (!Files.exists(target)) {
            LOG.info("[RESTORE] No existing {} to back up", target.getFileName());
            return null;
        }
        String base = target.getFileName() + SAFETY_BACKUP_INFIX + Timestamps.forFileName(clock);
        Path safety = target.resolveSibling(base);
        for (int n = 1; Files.exists(safety); n++) {
            safety = target.resolveSibling(base + "_" + n);
        }
        Files.copy(target, safety, StandardCopyOption.COPY_ATTRIBUTES);
        LOG.info("[RESTORE] Safety backup created: {}", safety);
        return safety;
    }

    // =====================================================================
    // Restore entry points
    // =====================================================================

    /**
     * Replaces the live database with {@code backupFile}.
     *
     * @throws ConfirmationDeclinedException if the operator declined
     * @throws IntegrityFailureException     if the backup is not a readable
     *                                       database, or failed verification
     *                                       while verified backups are
     *                                       required
     */
    public RestoreOperation restoreDatabase(Path backupFile, ConfirmationPrompt confirmation)
            throws LifecycleException, IOException {
        Attempt attempt = new Attempt(backupFile, RestoreType.DATABASE.label());
        try {
            requireExists(backupFile);
            confirm(confirmation, "Restore database from " + backupFile.getFileName()
                    + "? The live database will be replaced.");

            try (DatabaseLock.Handle ignored = lock.acquire("restore database")) {
                Path target = paths.database();
                attempt.safetyBackup = createSafetyBackup(target);
                checkVerification(backupFile, verifier.verifyIntegrity(backupFile), attempt);
                replaceDatabase(backupFile, target);
                LOG.info("[RESTORE] Database restored from {}", backupFile.getFileName());
                return record(attempt, RestoreStatus.SUCCESS);
            }
        } catch (ConfirmationDeclinedException e) {
            return declined(attempt, e);
        } catch (LifecycleException | IOException | RuntimeException e) {
            failed(attempt, e);
            throw e;
        }
    }

    /**
     * Restores database, configuration and logs from a full-system bundle.
     * The bundle is extracted and validated in a temporary directory before
     * any live path is written; the temporary directory is always removed.
     */
    public RestoreOperation restoreFullSystem(Path bundleFile, ConfirmationPrompt confirmation)
            throws LifecycleException, IOException {
        Attempt attempt = new Attempt(bundleFile, RestoreType.FULL_SYSTEM.label());
        try {
            requireExists(bundleFile);
            if (BackupType.infer(bundleFile) != BackupType.FULL_SYSTEM) {
                throw new UnsupportedFormatException("Full-system restore needs a .tar.gz bundle: "
                        + bundleFile.getFileName());
            }
            confirm(confirmation, "Restore full system from " + bundleFile.getFileName()
                    + "? This will overwrite current data, configuration and logs.");

            try (DatabaseLock.Handle ignored = lock.acquire("restore full system");
                    StagedBundle staged = StagedBundle.extract(bundleFile, paths.database().getFileName().toString())) {
                checkVerification(bundleFile, verifier.verifyIntegrity(staged.databaseFile()), attempt);

                attempt.safetyBackup = createSafetyBackup(paths.database());
                replaceDatabase(staged.databaseFile(), paths.database());
                Optional<Path> configTree = staged.subtree("config");
                if (configTree.isPresent()) {
                    int copied = copyTree(configTree.get(), paths.config());
                    attempt.notes.add("config files: " + copied);
                }
                Optional<Path> logsTree = staged.subtree("logs");
                if (logsTree.isPresent()) {
                    int copied = copyTree(logsTree.get(), paths.logs());
                    attempt.notes.add("log files: " + copied);
                }
                LOG.info("[RESTORE] Full system restored from {}", bundleFile.getFileName());
                return record(attempt, RestoreStatus.SUCCESS);
            }
        } catch (ConfirmationDeclinedException e) {
            return declined(attempt, e);
        } catch (LifecycleException | IOException | RuntimeException e) {
            failed(attempt, e);
            throw e;
        }
    }

    /**
     * Dispatches on {@code type}; {@link RestoreType#AUTO} infers it from the
     * file extension.
     *
     * @throws UnsupportedFormatException if the backup type cannot be
     *                                    restored; the attempt is audited
     */
    public RestoreOperation restoreFromBackup(Path backupFile, RestoreType type, ConfirmationPrompt confirmation)
            throws LifecycleException, IOException {
        RestoreType resolved = type;
        if (type == RestoreType.AUTO) {
            BackupType inferred = BackupType.infer(backupFile);
            Optional<RestoreType> restorable = RestoreType.of(inferred);
            if (restorable.isEmpty()) {
                UnsupportedFormatException e = new UnsupportedFormatException(
                        "Unsupported backup type " + inferred + " for " + backupFile.getFileName());
                failed(new Attempt(backupFile, inferred.name().toLowerCase(Locale.ROOT)), e);
                throw e;
            }
            resolved = restorable.get();
        }
        if (resolved == RestoreType.FULL_SYSTEM) {
            return restoreFullSystem(backupFile, confirmation);
        }
        return restoreDatabase(backupFile, confirmation);
    }

    public List<RestoreOperation> getRestoreHistory(int limit) {
        return history.recent(limit);
    }

    // =====================================================================
    // Steps
    // =====================================================================

    private static void requireExists(Path backupFile) throws NotFoundException {
        if (!Files.isRegularFile(backupFile)) {
            throw new NotFoundException("Backup file not found: " + backupFile);
        }
    }

    private static void confirm(ConfirmationPrompt confirmation, String question)
            throws ConfirmationDeclinedException {
        if (!confirmation.confirm(question)) {
            throw new ConfirmationDeclinedException("Restore declined by operator");
        }
    }

    /**
     * An unreadable database is always refused. Any other verification
     * failure, or a failed last known verification, is a warning unless
     * verified backups are required.
     */
    private void checkVerification(Path backupFile, VerificationReport report, Attempt attempt)
            throws IntegrityFailureException, IOException {
        if (!report.databaseReadable()) {
            throw new IntegrityFailureException("Backup is not a readable database", report.errors());
        }
        List<String> problems = new ArrayList<>(report.errors());
        Optional<VerificationStatus> lastKnown = verifier.lastKnownStatus(backupFile);
        if (lastKnown.isPresent() && lastKnown.get() != VerificationStatus.PASS) {
            problems.add("Last known verification: " + lastKnown.get());
        }
        if (problems.isEmpty()) {
            return;
        }
        if (config.isRequireVerifiedBackup()) {
            throw new IntegrityFailureException("Backup failed verification", problems);
        }
        LOG.warn("[RESTORE] Restoring {} despite verification problems: {}", backupFile.getFileName(), problems);
        attempt.notes.add("verification warnings: " + String.join("; ", problems));
    }

    /**
     * Copies {@code source} next to {@code target}, forces it to disk, drops
     * stale journal files and renames it over {@code target}.
     */
    private static void replaceDatabase(Path source, Path target) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Path staged = target.resolveSibling(target.getFileName() + ".restore.tmp");
        try {
            Files.copy(source, staged, StandardCopyOption.REPLACE_EXISTING);
            try (FileChannel channel = FileChannel.open(staged, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            for (String suffix : SQLITE_SIDE_FILES) {
                Files.deleteIfExists(target.resolveSibling(target.getFileName() + suffix));
            }
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    /** Copies every file below {@code source} into {@code destination}, overwriting. */
    private static int copyTree(Path source, Path destination) throws IOException {
        int[] copied = { 0 };
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(destination.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, destination.resolve(source.relativize(file).toString()),
                        StandardCopyOption.REPLACE_EXISTING);
                copied[0]++;
                return FileVisitResult.CONTINUE;
            }
        });
        return copied[0];
    }

    // =====================================================================
    // Audit
    // =====================================================================

    private RestoreOperation declined(Attempt attempt, ConfirmationDeclinedException e)
            throws ConfirmationDeclinedException {
        LOG.info("[RESTORE] Restore from {} declined", attempt.backupFile.getFileName());
        attempt.notes.add(e.getMessage());
        try {
            record(attempt, RestoreStatus.DECLINED);
        } catch (RuntimeException auditFailure) {
            e.addSuppressed(auditFailure);
        }
        throw e;
    }

    /** Audits a failed attempt; the caller rethrows {@code e}. */
    private void failed(Attempt attempt, Exception e) {
        LOG.error("[RESTORE] Restore from {} failed: {}", attempt.backupFile.getFileName(), e.getMessage());
        attempt.notes.add(String.valueOf(e.getMessage()));
        try {
            record(attempt, RestoreStatus.FAILED);
        } catch (RuntimeException auditFailure) {
            e.addSuppressed(auditFailure);
        }
    }

    private RestoreOperation record(Attempt attempt, RestoreStatus status) {
        String timestamp = Timestamps.forSql(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        RestoreOperation operation = history.append(new RestoreOperation(
                -1,
                timestamp,
                attempt.backupFile.toString(),
                attempt.restoreType,
                attempt.safetyBackup == null ? null : attempt.safetyBackup.toString(),
                status,
                attempt.notes.isEmpty() ? null : String.join("; ", attempt.notes)));
        eventBus.post(new RestoreCompletedEvent(attempt.backupFile, attempt.restoreType, status.label()));
        return operation;
    }

    /** Mutable state of one restore attempt, turned into its audit row at the end. */
    private static final class Attempt {

        private final Path backupFile;
        private final String restoreType;
        private final List<String> notes = new ArrayList<>();
        private Path safetyBackup;

        private Attempt(Path backupFile, String restoreType) {
            this.backupFile = backupFile;
            this.restoreType = restoreType;
        }
    }
}
