package de.bsommerfeld.canary.archive;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import de.bsommerfeld.canary.core.error.UnsupportedFormatException;
import de.bsommerfeld.canary.core.io.DurableFiles;
import de.bsommerfeld.canary.core.util.Json;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gzipped JSON encoding of {@link TableSnapshot}s.
 *
 * <p>
 * BLOB values are written as {@code {"base64": "..."}} so that they survive
 * the trip through JSON byte for byte. Everything else is written as the
 * JSON scalar SQLite returned.
 */
final class SnapshotCodec {

    static final String BLOB_FIELD = "base64";

    private final ObjectMapper mapper = Json.newMapper();
    private final ObjectWriter writer = mapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    /** Writes the snapshot durably; the file appears complete or not at all. */
    Path write(Path target, TableSnapshot snapshot) throws IOException {
        return DurableFiles.writeGzip(target, out -> writer.writeValue(out, snapshot));
    }

    TableSnapshot read(Path archive) throws IOException, UnsupportedFormatException {
        JsonNode root;
        try (InputStream in = new GzipCompressorInputStream(Files.newInputStream(archive))) {
            root = mapper.readTree(in);
        }
        if (root == null || !root.hasNonNull("table") || !root.path("records").isArray()) {
            throw new UnsupportedFormatException("Not a table snapshot: " + archive.getFileName());
        }

        List<String> primaryKey = new ArrayList<>();
        root.path("primary_key").forEach(n -> primaryKey.add(n.asText()));

        Map<String, String> columnTypes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> types = root.path("column_types").fields();
        while (types.hasNext()) {
            Map.Entry<String, JsonNode> type = types.next();
            columnTypes.put(type.getKey(), type.getValue().asText());
        }

        List<Map<String, Object>> records = new ArrayList<>();
        for (JsonNode row : root.path("records")) {
            Map<String, Object> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = row.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                values.put(field.getKey(), decode(field.getValue()));
            }
            records.add(values);
        }

        return new TableSnapshot(
                root.path("table").asText(),
                root.path("date_column").asText(null),
                root.path("retention_days").asInt(),
                root.path("cutoff").asText(null),
                root.path("archived_at").asText(null),
                root.path("record_count").asInt(records.size()),
                primaryKey,
                columnTypes,
                records);
    }

    /** Converts a JDBC value into its JSON-safe form. */
    static Object encode(Object value) {
        if (value instanceof byte[]) {
            return Map.of(BLOB_FIELD, Base64.getEncoder().encodeToString((byte[]) value));
        }
        return value;
    }

    static Object decode(JsonNode node) {
        if (node == null || node.isNull())
            return null;
        if (node.isIntegralNumber())
            return node.longValue();
        if (node.isNumber())
            return node.doubleValue();
        if (node.isBoolean())
            return node.booleanValue();
        if (node.isObject() && node.has(BLOB_FIELD))
            return Base64.getDecoder().decode(node.get(BLOB_FIELD).asText());
        if (node.isTextual())
            return node.textValue();
        return node.toString();
    }
}
