package de.bsommerfeld.canary.db.migration;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.canary.core.error.MigrationException;
import de.bsommerfeld.canary.core.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Source of migration definitions.
 *
 * <p>
 * Built-in migrations ship as a JSON array in {@code migrations/catalog.json}
 * on the classpath. Operators can add migrations without a rebuild by
 * dropping single-migration {@code *.json} files into the external
 * migrations directory; {@link SchemaMigrationEngine#createMigrationFile}
 * writes files in that format.
 */
public class MigrationCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationCatalog.class);
    static final String CLASSPATH_CATALOG = "migrations/catalog.json";

    private final ObjectMapper mapper = Json.newMapper();
    private final String classpathCatalog;
    private final Path externalDirectory;

    /**
     * @param externalDirectory directory with additional definitions; may be
     *                          {@code null} or absent
     */
    public MigrationCatalog(Path externalDirectory) {
        this(CLASSPATH_CATALOG, externalDirectory);
    }

    MigrationCatalog(String classpathCatalog, Path externalDirectory) {
        this.classpathCatalog = classpathCatalog;
        this.externalDirectory = externalDirectory;
    }

    public Path externalDirectory() {
        return externalDirectory;
    }

    /**
     * Loads all definitions sorted by ascending version.
     *
     * @throws MigrationException on unreadable files, invalid versions, empty
     *                            up statements or duplicate versions
     */
    public List<Migration> load() throws MigrationException {
        List<Migration> all = new ArrayList<>(loadClasspath());
        all.addAll(loadExternal());

        Map<MigrationVersion, Migration> byVersion = new TreeMap<>();
        for (Migration m : all) {
            validate(m);
            if (byVersion.putIfAbsent(m.parsedVersion(), m) != null) {
                throw new MigrationException(m.version(), "Duplicate migration version " + m.version());
            }
        }
        return new ArrayList<>(byVersion.values());
    }

    private List<Migration> loadClasspath() throws MigrationException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(classpathCatalog)) {
            if (in == null) {
                LOG.warn("[MIGRATE] No built-in catalog at {}", classpathCatalog);
                return List.of();
            }
            return mapper.readValue(in, new TypeReference<List<Migration>>() {
            });
        } catch (IOException e) {
            throw new MigrationException(null, "Failed to read built-in catalog " + classpathCatalog, List.of(), e);
        }
    }

    private List<Migration> loadExternal() throws MigrationException {
        if (externalDirectory == null || !Files.isDirectory(externalDirectory))
            return List.of();

        List<Path> files;
        try (Stream<Path> stream = Files.list(externalDirectory)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MigrationException(null, "Cannot list migrations directory " + externalDirectory, List.of(), e);
        }

        List<Migration> migrations = new ArrayList<>();
        for (Path file : files) {
            try {
                migrations.add(mapper.readValue(file.toFile(), Migration.class));
                LOG.debug("[MIGRATE] Loaded definition {}", file.getFileName());
            } catch (IOException e) {
                throw new MigrationException(null, "Invalid migration file " + file.getFileName(), List.of(), e);
            }
        }
        return migrations;
    }

    private static void validate(Migration m) throws MigrationException {
        if (!MigrationVersion.isValid(m.version())) {
            throw new MigrationException(m.version(), "Invalid migration version '" + m.version() + "'");
        }
        if (m.description() == null || m.description().isBlank()) {
            throw new MigrationException(m.version(), "Migration " + m.version() + " has no description");
        }
        if (m.up().isEmpty()) {
            throw new MigrationException(m.version(), "Migration " + m.version() + " has no up statements");
        }
    }
}
