package de.bsommerfeld.canary.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link LifecycleConfig} from a YAML file.
 *
 * <p>
 * User values are layered over the defaults of a fresh {@code LifecycleConfig}:
 * nested sections are merged key by key, so a file that only sets
 * {@code verification.sample-size} keeps every other default. When the file
 * does not exist yet it is created with the full default configuration, which
 * gives operators a documented starting point.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setDefaultMergeable(Boolean.TRUE);

    private ConfigLoader() {
    }

    /**
     * Reads the configuration at {@code configFile}, writing defaults first if
     * the file is missing.
     *
     * @throws IOException if the file exists but cannot be read or parsed, or
     *                     the defaults cannot be written
     */
    public static LifecycleConfig load(Path configFile) throws IOException {
        LifecycleConfig config = new LifecycleConfig();

        if (!Files.exists(configFile)) {
            LOG.info("No configuration at {}, writing defaults", configFile.toAbsolutePath());
            write(config, configFile);
            return config;
        }

        LOG.info("Loading configuration from {}", configFile.toAbsolutePath());
        return YAML.readerForUpdating(config).readValue(configFile.toFile());
    }

    /** Persists the given configuration, creating parent directories as needed. */
    public static void write(LifecycleConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        YAML.writeValue(configFile.toFile(), config);
    }
}
