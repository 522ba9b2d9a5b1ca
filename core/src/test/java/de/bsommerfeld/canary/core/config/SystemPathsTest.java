package de.bsommerfeld.canary.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SystemPathsTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty("canary.home");
    }

    @Test
    void of_shouldResolveAgainstHome() {
        SystemPaths paths = SystemPaths.of(tempDir, new PathsConfig());

        assertEquals(tempDir.resolve("data/canary_protocol.db"), paths.database());
        assertEquals(tempDir.resolve("backups"), paths.backups());
        assertEquals(tempDir.resolve("data/archives"), paths.archives());
        assertEquals(tempDir.resolve("logs"), paths.logs());
    }

    @Test
    void resolveHome_shouldPreferSystemProperty() {
        System.setProperty("canary.home", tempDir.toString());

        assertEquals(tempDir.toAbsolutePath(), SystemPaths.resolveHome());
    }

    @Test
    void configFile_shouldLiveInConfigDirectory() {
        assertEquals(tempDir.resolve("config/lifecycle.yaml"), SystemPaths.configFile(tempDir));
    }
}
