package de.bsommerfeld.canary.backup;

import java.nio.file.Path;
import java.util.Locale;

/** Backup formats, inferred from the file extension. */
public enum BackupType {

    DATABASE(".db"),
    JSON_EXPORT(".json"),
    FULL_SYSTEM(".tar.gz"),
    SQL_DUMP(".sql"),
    ZIP_ARCHIVE(".zip"),
    UNKNOWN("");

    private final String extension;

    BackupType(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static BackupType infer(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (BackupType type : values()) {
            if (type != UNKNOWN && name.endsWith(type.extension)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
