package de.bsommerfeld.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Root of the lifecycle configuration tree, persisted as
 * {@code config/lifecycle.yaml}. Every section carries its defaults in field
 * initializers, so a freshly constructed instance is a complete, valid
 * configuration.
 *
 * @see ConfigLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LifecycleConfig {

    @JsonProperty("paths")
    @JsonPropertyDescription("File system locations of the database, backups, archives and reports")
    private PathsConfig paths = new PathsConfig();

    @JsonProperty("verification")
    @JsonPropertyDescription("Backup verification settings")
    private VerificationConfig verification = new VerificationConfig();

    @JsonProperty("archival")
    @JsonPropertyDescription("Retention policies for live tables and log files")
    private ArchivalConfig archival = new ArchivalConfig();

    @JsonProperty("restore")
    @JsonPropertyDescription("Restore safety settings")
    private RestoreConfig restore = new RestoreConfig();

    public PathsConfig getPaths() {
        return paths;
    }

    public VerificationConfig getVerification() {
        return verification;
    }

    public ArchivalConfig getArchival() {
        return archival;
    }

    public RestoreConfig getRestore() {
        return restore;
    }
}
