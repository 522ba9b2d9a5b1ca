package de.bsommerfeld.canary.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteFormatterTest {

    @Test
    void format_shouldReturnBytesForSmallValues() {
        assertEquals("0 B", ByteFormatter.format(0));
        assertEquals("1023 B", ByteFormatter.format(1023));
    }

    @Test
    void format_shouldScaleWithRootLocale() {
        assertEquals("1.5 KB", ByteFormatter.format(1536));
        assertEquals("1.0 MB", ByteFormatter.format(1024 * 1024));
    }

    @Test
    void format_shouldReachTerabytes() {
        assertEquals("2.0 GB", ByteFormatter.format(2L * 1024 * 1024 * 1024));
        assertEquals("1.0 TB", ByteFormatter.format(1024L * 1024 * 1024 * 1024));
        assertEquals("2048.0 TB", ByteFormatter.format(2048L * 1024 * 1024 * 1024 * 1024));
    }

    @Test
    void format_shouldHandleNegativeValues() {
        assertEquals("? B", ByteFormatter.format(-1));
    }

    @Test
    void toMegabytes_shouldRoundToTwoDecimals() {
        assertEquals(0.5, ByteFormatter.toMegabytes(512 * 1024), 1e-9);
        assertEquals(0.01, ByteFormatter.toMegabytes(10_000), 1e-9);
        assertEquals(0.0, ByteFormatter.toMegabytes(0), 1e-9);
    }
}
