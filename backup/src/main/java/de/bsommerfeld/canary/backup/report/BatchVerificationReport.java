package de.bsommerfeld.canary.backup.report;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Aggregate of a batch verification run, persisted as
 * {@code verification_report_<yyyyMMdd_HHmmss>.json}.
 *
 * @param backupsFound all backups with a matching extension, before the age
 *                     filter
 * @param cancelled    the run stopped early; results cover the backups
 *                     processed until then
 */
public record BatchVerificationReport(
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        String backupDirectory,
        int backupsFound,
        int backupsVerified,
        int backupsFailed,
        List<Item> verificationResults,
        Summary summary,
        boolean cancelled) {

    public BatchVerificationReport {
        verificationResults = List.copyOf(verificationResults);
    }

    /**
     * Per-backup result.
     *
     * @param restorationTest {@code null} for non-database backups and errors
     * @param error           set only for {@link VerificationStatus#ERROR}
     */
    public record Item(
            String backupFile,
            long backupAgeDays,
            VerificationStatus overallStatus,
            VerificationReport integrityCheck,
            RestorationReport restorationTest,
            String error) {
    }

    /**
     * @param oldestVerifiedBackup age in days of the oldest passing backup,
     *                             {@code null} if none passed
     */
    public record Summary(
            double successRate,
            Long oldestVerifiedBackup,
            Long newestVerifiedBackup,
            double totalBackupSizeMb) {
    }
}
