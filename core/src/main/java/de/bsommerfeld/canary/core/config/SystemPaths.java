package de.bsommerfeld.canary.core.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Absolute locations derived from {@link PathsConfig} and an application home.
 * All paths are returned but <strong>not</strong> created; components create
 * the directories they write to.
 *
 * <p>
 * The home is resolved from the {@code canary.home} system property, then the
 * {@code CANARY_HOME} environment variable, falling back to the working
 * directory.
 */
public record SystemPaths(
        Path home,
        Path database,
        Path backups,
        Path archives,
        Path reports,
        Path logs,
        Path config,
        Path migrations) {

    public static SystemPaths of(Path home, PathsConfig paths) {
        Path root = home.toAbsolutePath().normalize();
        return new SystemPaths(
                root,
                root.resolve(paths.getDatabase()).normalize(),
                root.resolve(paths.getBackups()).normalize(),
                root.resolve(paths.getArchives()).normalize(),
                root.resolve(paths.getReports()).normalize(),
                root.resolve(paths.getLogs()).normalize(),
                root.resolve(paths.getConfig()).normalize(),
                root.resolve(paths.getMigrations()).normalize());
    }

    /** Resolves the application home from system property, environment or cwd. */
    public static Path resolveHome() {
        String home = System.getProperty("canary.home");
        if (home == null || home.isEmpty()) {
            home = System.getenv("CANARY_HOME");
        }
        if (home == null || home.isEmpty()) {
            return Paths.get("").toAbsolutePath();
        }
        return Paths.get(home).toAbsolutePath();
    }

    /** Default location of the configuration file below the given home. */
    public static Path configFile(Path home) {
        return home.resolve("config").resolve("lifecycle.yaml");
    }
}
