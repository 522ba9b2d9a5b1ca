package de.bsommerfeld.canary.cli;

import com.google.inject.Inject;
import de.bsommerfeld.canary.backup.BackupIntegrityVerifier;
import de.bsommerfeld.canary.backup.report.BatchVerificationReport;
import de.bsommerfeld.canary.backup.report.RestorationReport;
import de.bsommerfeld.canary.backup.report.VerificationHistoryEntry;
import de.bsommerfeld.canary.backup.report.VerificationReport;
import de.bsommerfeld.canary.core.concurrent.CancellationToken;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.error.LifecycleException;
import de.bsommerfeld.canary.core.util.ByteFormatter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/** {@code verify [--run [dir] | --file <path> | --test-restore <path> | --history [days]]} */
class VerifyCommand implements Command {

    private final BackupIntegrityVerifier verifier;
    private final SystemPaths paths;
    private final PrintStream out;

    @Inject
    VerifyCommand(BackupIntegrityVerifier verifier, SystemPaths paths, Console console) {
        this.verifier = verifier;
        this.paths = paths;
        this.out = console.out();
    }

    @Override
    public int execute(CommandLine args) throws UsageException, LifecycleException, IOException {
        args.allowOnly(Set.of("run", "file", "test-restore", "history"));

        if (args.has("file")) {
            return printReport(verifier.verifyIntegrity(Path.of(args.value("file"))));
        }
        if (args.has("test-restore")) {
            return printRestoration(verifier.testRestoration(Path.of(args.value("test-restore"))));
        }
        if (args.has("history")) {
            return history(args.intValue("history", 30));
        }

        Path dir = args.values("run").isEmpty() ? paths.backups() : Path.of(args.value("run"));
        out.printf("Verifying backups in %s%n", dir);
        BatchVerificationReport report = verifier.runBatchVerification(dir, CancellationToken.none());
        out.printf("Found %d, verified %d, failed %d (success rate %.1f%%, %.2f MB)%n",
                report.backupsFound(), report.backupsVerified(), report.backupsFailed(),
                report.summary().successRate(), report.summary().totalBackupSizeMb());
        return report.backupsFailed() == 0 ? LifecycleCli.OK : LifecycleCli.FAILURE;
    }

    private int printReport(VerificationReport report) {
        out.printf("%s %s%n", report.overallValid() ? "PASS" : "FAIL", report.backupFile());
        out.printf("  size       %s%n", ByteFormatter.format(report.fileSizeBytes()));
        out.printf("  checksum   %s%n", report.checksum());
        out.printf("  readable   %s (%d tables)%n", report.databaseReadable(), report.tableCount());
        out.printf("  schema     %s%n", report.schemaValid());
        out.printf("  sample     %s%n", report.dataSampleValid());
        report.errors().forEach(e -> out.printf("  error: %s%n", e));
        return report.overallValid() ? LifecycleCli.OK : LifecycleCli.FAILURE;
    }

    private int printRestoration(RestorationReport report) {
        out.printf("%s trial restore of %s%n", report.restorationSuccessful() ? "PASS" : "FAIL", report.backupFile());
        if (report.operationTests() != null) {
            out.printf("  tables %d, join rows %d%n", report.operationTests().tableCount(),
                    report.operationTests().joinTest());
        }
        out.printf("  took %.2fs%n", report.performanceMetrics().totalTimeSeconds());
        report.errors().forEach(e -> out.printf("  error: %s%n", e));
        return report.restorationSuccessful() ? LifecycleCli.OK : LifecycleCli.FAILURE;
    }

    private int history(int days) throws IOException {
        List<VerificationHistoryEntry> entries = verifier.getVerificationHistory(days);
        if (entries.isEmpty()) {
            out.printf("No verification runs in the last %d days%n", days);
        }
        for (VerificationHistoryEntry entry : entries) {
            out.printf("%s  found %d  verified %d  failed %d%s%n", entry.startedAt(), entry.backupsFound(),
                    entry.backupsVerified(), entry.backupsFailed(), entry.cancelled() ? "  (cancelled)" : "");
        }
        return LifecycleCli.OK;
    }
}
