package de.bsommerfeld.canary.cli;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineTest {

    @Test
    void parse_shouldCollectValuesPerFlag() throws Exception {
        CommandLine line = CommandLine.parse("migrate", "--create", "1.3.0", "Add", "index",
                "--up", "CREATE INDEX a ON t(x)", "--up", "CREATE INDEX b ON t(y)");

        assertEquals("migrate", line.command());
        assertEquals(List.of("1.3.0", "Add", "index"), line.values("create"));
        assertEquals(2, line.values("up").size());
        assertTrue(line.values("down").isEmpty());
    }

    @Test
    void parse_shouldRejectValuesBeforeAnyFlag() {
        assertThrows(UsageException.class, () -> CommandLine.parse("verify", "stray"));
        assertThrows(UsageException.class, () -> CommandLine.parse("--status"));
    }

    @Test
    void value_shouldRequireExactlyOneValue() throws Exception {
        CommandLine line = CommandLine.parse("restore", "--file", "a.db", "b.db", "--history");

        assertThrows(UsageException.class, () -> line.value("file"));
        assertEquals(10, line.intValue("history", 10));
        assertThrows(UsageException.class, () -> line.allowOnly(Set.of("file")));
    }

    @Test
    void intValue_shouldRejectNonNumbers() throws Exception {
        CommandLine line = CommandLine.parse("verify", "--history", "week");

        assertThrows(UsageException.class, () -> line.intValue("history", 30));
    }
}
