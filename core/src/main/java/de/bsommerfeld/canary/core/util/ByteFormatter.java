package de.bsommerfeld.canary.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Byte sizes for console output and JSON reports. Console output scales to
 * the largest fitting binary unit, reports carry plain megabytes.
 */
public final class ByteFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};
    private static final double MEGABYTE = 1024.0 * 1024.0;

    private ByteFormatter() {
    }

    /** {@code 1536} becomes {@code "1.5 KB"}; negative sizes are unknown. */
    public static String format(long bytes) {
        if (bytes < 0)
            return "? B";
        if (bytes < 1024)
            return bytes + " B";

        int unit = Math.min(UNITS.length - 1, (63 - Long.numberOfLeadingZeros(bytes)) / 10);
        return String.format(Locale.ROOT, "%.1f %s", bytes / Math.pow(1024, unit), UNITS[unit]);
    }

    /** Megabytes rounded half-up to two decimals. */
    public static double toMegabytes(long bytes) {
        return BigDecimal.valueOf(bytes / MEGABYTE).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
