package de.bsommerfeld.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.annotation.OptBoolean;

import java.util.ArrayList;
import java.util.List;

/**
 * Retention windows per table class. Raw feed data is kept for a year,
 * time-series indicators for two, digests and feedback for three; log files
 * for 90 days.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchivalConfig {

    @JsonProperty("tables")
    @JsonPropertyDescription("Per-table retention policies, archived in the listed order")
    @JsonMerge(OptBoolean.FALSE)
    private List<TablePolicy> tables = new ArrayList<>(List.of(
            new TablePolicy("daily_headlines", "date", 365),
            new TablePolicy("daily_economic", "date", 730),
            new TablePolicy("weekly_digests", "date", 1095),
            new TablePolicy("user_feedback", "created_at", 1095),
            new TablePolicy("individual_article_feedback", "digest_date", 1095)));

    @JsonProperty("log-retention-days")
    @JsonPropertyDescription("Log files older than this are bundled and removed (default: 90)")
    private int logRetentionDays = 90;

    public List<TablePolicy> getTables() {
        return tables;
    }

    public void setTables(List<TablePolicy> tables) {
        this.tables = tables;
    }

    public int getLogRetentionDays() {
        return logRetentionDays;
    }

    public void setLogRetentionDays(int logRetentionDays) {
        this.logRetentionDays = logRetentionDays;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TablePolicy {

        @JsonProperty("table")
        private String table;

        @JsonProperty("date-column")
        private String dateColumn;

        @JsonProperty("retention-days")
        private int retentionDays;

        public TablePolicy() {
        }

        public TablePolicy(String table, String dateColumn, int retentionDays) {
            this.table = table;
            this.dateColumn = dateColumn;
            this.retentionDays = retentionDays;
        }

        public String getTable() {
            return table;
        }

        public String getDateColumn() {
            return dateColumn;
        }

        public int getRetentionDays() {
            return retentionDays;
        }
    }
}
