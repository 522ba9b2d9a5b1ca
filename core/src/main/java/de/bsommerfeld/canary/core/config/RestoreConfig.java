package de.bsommerfeld.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RestoreConfig {

    @JsonProperty("require-verified-backup")
    @JsonPropertyDescription("Refuse restores whose pre-restore verification or last known verification failed (default: false, warn only)")
    private boolean requireVerifiedBackup = false;

    public boolean isRequireVerifiedBackup() {
        return requireVerifiedBackup;
    }

    public void setRequireVerifiedBackup(boolean requireVerifiedBackup) {
        this.requireVerifiedBackup = requireVerifiedBackup;
    }
}
