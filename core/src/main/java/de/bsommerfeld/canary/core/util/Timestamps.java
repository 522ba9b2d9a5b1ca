package de.bsommerfeld.canary.core.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Timestamp formats shared by every file the lifecycle components produce.
 * File names use {@code yyyyMMdd_HHmmss} so that lexical order equals
 * chronological order; SQL comparisons use SQLite's {@code datetime()} text
 * format.
 */
public final class Timestamps {

    public static final DateTimeFormatter FILE_NAME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    public static final DateTimeFormatter SQL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {
    }

    /** Local wall-clock stamp for file names, e.g. {@code 20260118_093000}. */
    public static String forFileName(Clock clock) {
        return LocalDateTime.now(clock).format(FILE_NAME);
    }

    /** UTC stamp in SQLite {@code datetime()} format. */
    public static String forSql(LocalDateTime utc) {
        return utc.format(SQL);
    }
}
