package de.bsommerfeld.canary.backup.report;

import java.nio.file.Path;

/** Headline figures of a persisted batch verification report. */
public record VerificationHistoryEntry(
        Path reportFile,
        String startedAt,
        int backupsFound,
        int backupsVerified,
        int backupsFailed,
        boolean cancelled) {
}
