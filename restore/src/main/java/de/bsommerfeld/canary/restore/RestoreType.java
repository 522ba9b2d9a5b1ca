package de.bsommerfeld.canary.restore;

import de.bsommerfeld.canary.backup.BackupType;
import de.bsommerfeld.canary.core.error.UnsupportedFormatException;

import java.util.Locale;
import java.util.Optional;

/** What a restore replaces. {@link #AUTO} is resolved from the backup file name. */
public enum RestoreType {

    AUTO,
    DATABASE,
    FULL_SYSTEM;

    /** Lower-case label used in the audit table and on the command line. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** The restore type a backup type can be restored as, if any. */
    public static Optional<RestoreType> of(BackupType backupType) {
        switch (backupType) {
            case DATABASE:
                return Optional.of(DATABASE);
            case FULL_SYSTEM:
                return Optional.of(FULL_SYSTEM);
            default:
                return Optional.empty();
        }
    }

    public static RestoreType parse(String label) throws UnsupportedFormatException {
        for (RestoreType type : values()) {
            if (type.label().equals(label.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new UnsupportedFormatException("Unknown restore type: " + label);
    }
}
