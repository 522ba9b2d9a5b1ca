package de.bsommerfeld.canary.db.migration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import de.bsommerfeld.canary.core.util.HashUtil;

import java.util.List;

/**
 * A versioned schema change. {@code up} and {@code down} are ordered lists of
 * complete SQL statements; they are executed one by one and never split on
 * semicolons, so statements may contain string literals or trigger bodies.
 *
 * @param down rollback statements, empty if the migration cannot be rolled
 *             back
 */
public record Migration(String version, String description, List<String> up, List<String> down) {

    public Migration {
        up = up == null ? List.of() : List.copyOf(up);
        down = down == null ? List.of() : List.copyOf(down);
    }

    @JsonIgnore
    public MigrationVersion parsedVersion() {
        return MigrationVersion.parse(version);
    }

    @JsonIgnore
    public boolean hasRollback() {
        return !down.isEmpty();
    }

    /** SHA-256 over the up statements, stored with the applied row. */
    @JsonIgnore
    public String checksum() {
        return HashUtil.sha256(up);
    }
}
