package de.bsommerfeld.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Relative or absolute locations used by the lifecycle components. Relative
 * paths are resolved against the application home by {@link SystemPaths}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PathsConfig {

    @JsonProperty("database")
    @JsonPropertyDescription("Live SQLite database file (default: data/canary_protocol.db)")
    private String database = "data/canary_protocol.db";

    @JsonProperty("backups")
    @JsonPropertyDescription("Directory holding database snapshots and full-system bundles (default: backups)")
    private String backups = "backups";

    @JsonProperty("archives")
    @JsonPropertyDescription("Directory receiving table snapshots and log bundles (default: data/archives)")
    private String archives = "data/archives";

    @JsonProperty("reports")
    @JsonPropertyDescription("Directory receiving verification and archival JSON reports (default: data/verification)")
    private String reports = "data/verification";

    @JsonProperty("logs")
    @JsonPropertyDescription("Application log directory (default: logs)")
    private String logs = "logs";

    @JsonProperty("config")
    @JsonPropertyDescription("Configuration directory included in full-system bundles (default: config)")
    private String config = "config";

    @JsonProperty("migrations")
    @JsonPropertyDescription("Optional directory with additional migration definitions (default: migrations)")
    private String migrations = "migrations";

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getBackups() {
        return backups;
    }

    public void setBackups(String backups) {
        this.backups = backups;
    }

    public String getArchives() {
        return archives;
    }

    public String getReports() {
        return reports;
    }

    public String getLogs() {
        return logs;
    }

    public String getConfig() {
        return config;
    }

    public String getMigrations() {
        return migrations;
    }
}
