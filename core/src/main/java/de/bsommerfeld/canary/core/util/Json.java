package de.bsommerfeld.canary.core.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.bsommerfeld.canary.core.io.DurableFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Jackson setup for every JSON file the lifecycle components write: reports,
 * table snapshots and migration definitions. Keys are snake_case and
 * timestamps ISO-8601, so the files stay readable by the scripts that consumed
 * the reports before.
 *
 * <p>
 * {@link ObjectMapper} is thread-safe after configuration; components keep a
 * single instance.
 */
public final class Json {

    private Json() {
    }

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes {@code value} to {@code target} through a temporary sibling and
     * an atomic rename, so readers never observe a half-written report.
     */
    public static void writeAtomically(ObjectMapper mapper, Object value, Path target) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), value);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Writes {@code value} to a new, fsynced file. Run reports go through
     * here: an existing report is never replaced.
     *
     * @throws java.nio.file.FileAlreadyExistsException if {@code target} exists
     */
    public static Path writeNew(ObjectMapper mapper, Object value, Path target) throws IOException {
        return DurableFiles.write(target,
                out -> mapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, value));
    }
}
