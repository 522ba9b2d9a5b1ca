package de.bsommerfeld.canary.backup.report;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of a trial restoration into a throwaway copy.
 *
 * @param operationTests {@code null} if the probe queries could not run
 */
public record RestorationReport(
        String backupFile,
        LocalDateTime testedAt,
        boolean restorationSuccessful,
        boolean dataIntegrityVerified,
        OperationProbe operationTests,
        Timings performanceMetrics,
        List<String> errors) {

    public RestorationReport {
        errors = List.copyOf(errors);
    }

    /** Results of the queries run against the restored copy. */
    public record OperationProbe(int tableCount, long joinTest) {
    }

    public record Timings(double copyTimeSeconds, double verificationTimeSeconds, double totalTimeSeconds) {

        public static final Timings NONE = new Timings(0, 0, 0);
    }
}
