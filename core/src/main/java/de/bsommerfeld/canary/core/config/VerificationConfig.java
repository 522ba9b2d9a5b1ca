package de.bsommerfeld.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.annotation.OptBoolean;

import java.util.ArrayList;
import java.util.List;

/**
 * Backup verification parameters. Values are persisted in lifecycle.yaml
 * and loaded at startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VerificationConfig {

    @JsonProperty("max-backup-age-days")
    @JsonPropertyDescription("Only backups modified within this many days are verified in a batch run (default: 30)")
    private int maxBackupAgeDays = 30;

    @JsonProperty("sample-size")
    @JsonPropertyDescription("Rows sampled per critical table during data verification (default: 100)")
    private int sampleSize = 100;

    @JsonProperty("critical-tables")
    @JsonPropertyDescription("Tables whose sampled rows must satisfy their NOT NULL constraints")
    @JsonMerge(OptBoolean.FALSE)
    private List<String> criticalTables = new ArrayList<>(List.of("weekly_digests", "daily_headlines", "user_feedback"));

    @JsonProperty("extensions")
    @JsonPropertyDescription("File extensions discovered as verifiable backups (default: .db)")
    @JsonMerge(OptBoolean.FALSE)
    private List<String> extensions = new ArrayList<>(List.of(".db"));

    public int getMaxBackupAgeDays() {
        return maxBackupAgeDays;
    }

    public void setMaxBackupAgeDays(int maxBackupAgeDays) {
        this.maxBackupAgeDays = maxBackupAgeDays;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public List<String> getCriticalTables() {
        return criticalTables;
    }

    public void setCriticalTables(List<String> criticalTables) {
        this.criticalTables = criticalTables;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public void setExtensions(List<String> extensions) {
        this.extensions = extensions;
    }
}
