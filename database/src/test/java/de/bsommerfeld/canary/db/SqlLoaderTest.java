package de.bsommerfeld.canary.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlLoaderTest {

    @Test
    void load_shouldReturnTrackingTableDdl() {
        String sql = SqlLoader.load("create-schema-migrations");
        assertTrue(sql.toLowerCase().contains("create table if not exists schema_migrations"));
    }

    @Test
    void load_shouldReturnTrimmedStatement() {
        String sql = SqlLoader.load("insert-migration");
        assertEquals(sql.trim(), sql);
        assertTrue(sql.startsWith("INSERT"));
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        assertSame(SqlLoader.load("select-user-tables"), SqlLoader.load("select-user-tables"));
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.load("nonexistent-sql-file"));
    }
}
