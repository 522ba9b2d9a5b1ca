package de.bsommerfeld.canary.archive;

import java.nio.file.Path;

/** Kinds of files in the archive directory, inferred from the file name. */
public enum ArchiveKind {

    /** {@code <table>_<ts>.json.gz} written by table archival. */
    TABLE_SNAPSHOT,
    /** {@code logs_<ts>.tar.gz} written by log archival. */
    LOG_BUNDLE,
    OTHER;

    public static ArchiveKind infer(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(".json.gz"))
            return TABLE_SNAPSHOT;
        if (name.startsWith(DataArchivalManager.LOG_BUNDLE_PREFIX) && name.endsWith(".tar.gz"))
            return LOG_BUNDLE;
        return OTHER;
    }
}
