package de.bsommerfeld.canary.backup.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of an integrity check of one backup file.
 *
 * @param expectedChecksum hash from the {@code .sha256} sidecar, {@code null}
 *                         if there is none
 * @param schemaComparison {@code null} if the schema could not be compared
 */
public record VerificationReport(
        String backupFile,
        LocalDateTime verifiedAt,
        boolean fileExists,
        long fileSizeBytes,
        String checksum,
        String expectedChecksum,
        boolean databaseReadable,
        int tableCount,
        boolean schemaValid,
        SchemaComparison schemaComparison,
        boolean dataSampleValid,
        List<String> errors) {

    public VerificationReport {
        errors = List.copyOf(errors);
    }

    /** All checks passed and no error was recorded. */
    @JsonProperty("overall_valid")
    public boolean overallValid() {
        return fileExists && databaseReadable && schemaValid && dataSampleValid && errors.isEmpty();
    }

    public static Builder builder(String backupFile, LocalDateTime verifiedAt) {
        return new Builder(backupFile, verifiedAt);
    }

    /** Collects check results while a verification is in progress. */
    public static final class Builder {

        private final String backupFile;
        private final LocalDateTime verifiedAt;
        private final List<String> errors = new ArrayList<>();
        private boolean fileExists;
        private long fileSizeBytes;
        private String checksum = "";
        private String expectedChecksum;
        private boolean databaseReadable;
        private int tableCount;
        private boolean schemaValid;
        private SchemaComparison schemaComparison;
        private boolean dataSampleValid;

        private Builder(String backupFile, LocalDateTime verifiedAt) {
            this.backupFile = backupFile;
            this.verifiedAt = verifiedAt;
        }

        public Builder fileExists(boolean value) {
            this.fileExists = value;
            return this;
        }

        public Builder fileSizeBytes(long value) {
            this.fileSizeBytes = value;
            return this;
        }

        public Builder checksum(String value) {
            this.checksum = value;
            return this;
        }

        public Builder expectedChecksum(String value) {
            this.expectedChecksum = value;
            return this;
        }

        public Builder databaseReadable(boolean value) {
            this.databaseReadable = value;
            return this;
        }

        public Builder tableCount(int value) {
            this.tableCount = value;
            return this;
        }

        public Builder schemaValid(boolean value) {
            this.schemaValid = value;
            return this;
        }

        public Builder schemaComparison(SchemaComparison value) {
            this.schemaComparison = value;
            return this;
        }

        public Builder dataSampleValid(boolean value) {
            this.dataSampleValid = value;
            return this;
        }

        public Builder error(String message) {
            errors.add(message);
            return this;
        }

        public VerificationReport build() {
            return new VerificationReport(backupFile, verifiedAt, fileExists, fileSizeBytes, checksum,
                    expectedChecksum, databaseReadable, tableCount, schemaValid, schemaComparison, dataSampleValid,
                    errors);
        }
    }
}
