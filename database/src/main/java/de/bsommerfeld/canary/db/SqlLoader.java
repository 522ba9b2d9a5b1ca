package de.bsommerfeld.canary.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code insert-restore-history.sql}, {@code select-archive-history.sql}.
 * Statements whose table name is only known at runtime (archival and
 * schema inspection) are built in code instead, with quoted identifiers.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath,
     * trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
