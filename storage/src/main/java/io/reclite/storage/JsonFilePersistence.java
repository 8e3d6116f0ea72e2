// file: src/main/java/io/reclite/storage/JsonFilePersistence.java
package io.reclite.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.reclite.core.InvalidInputException;
import io.reclite.core.RecordJson;
import io.reclite.core.RecordValue;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * JSON snapshot file, one per database.
 * <p>
 * Format (pretty-printed):
 * <pre>
 * {
 *   "User": { "Alice": { "name": "Alice", "age": 30 } },
 *   "__schemas__": { "definition": "{\"User\":\"name:string age:int\"}" }
 * }
 * </pre>
 * Schema definitions ride along as one more top-level entry under
 * {@link Snapshot#RESERVED_SCHEMA_NAME}, holding a JSON-encoded name -> definition map.
 * Records stored as JSON strings (older files) are decoded on load.
 * <p>
 * Atomicity:
 *   - write "&lt;file&gt;.tmp" first,
 *   - then move it over "&lt;file&gt;" with ATOMIC_MOVE.
 */
public final class JsonFilePersistence implements Persistence {
    private static final Logger log = Logger.getLogger(JsonFilePersistence.class.getName());

    private static final String DEFINITION_FIELD = "definition";

    private final ObjectMapper json = RecordJson.mapper();

    @Override
    public void save(Path file, Snapshot snapshot) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");

        ObjectNode root = json.createObjectNode();
        for (Map.Entry<String, Map<String, RecordValue.ObjectValue>> schema : snapshot.records().entrySet()) {
            ObjectNode byKey = root.putObject(schema.getKey());
            for (Map.Entry<String, RecordValue.ObjectValue> rec : schema.getValue().entrySet()) {
                byKey.set(rec.getKey(), RecordJson.toNode(rec.getValue()));
            }
        }
        root.putObject(Snapshot.RESERVED_SCHEMA_NAME)
                .put(DEFINITION_FIELD, json.writeValueAsString(snapshot.schemas()));

        try (OutputStream out = Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            json.writerWithDefaultPrettyPrinter().writeValue(out, root);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw e;
        }

        try {
            try {
                Files.move(tmp, file, ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.log(Level.FINE, "Atomic move not supported for {0}, replacing instead", file);
                Files.move(tmp, file, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw e;
        }
        log.log(Level.FINE, "Saved {0} schemas to {1}", new Object[]{snapshot.schemas().size(), file});
    }

    @Override
    public Snapshot load(Path file) throws IOException {
        if (!Files.exists(file)) {
            return Snapshot.empty();
        }
        JsonNode root = json.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Snapshot file " + file + " does not hold a JSON object");
        }

        Map<String, Map<String, RecordValue.ObjectValue>> records = new LinkedHashMap<>();
        Map<String, String> schemas = new LinkedHashMap<>();

        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (Snapshot.RESERVED_SCHEMA_NAME.equals(entry.getKey())) {
                schemas.putAll(readSchemas(file, entry.getValue()));
            } else {
                records.put(entry.getKey(), readRecords(file, entry.getKey(), entry.getValue()));
            }
        }
        return new Snapshot(records, schemas);
    }

    private Map<String, String> readSchemas(Path file, JsonNode node) throws IOException {
        JsonNode definition = node.get(DEFINITION_FIELD);
        if (definition == null || definition.isNull()) {
            return Map.of();
        }
        if (!definition.isTextual()) {
            throw new IOException("Malformed schema entry in " + file);
        }
        JsonNode parsed = json.readTree(definition.textValue());
        if (parsed == null || !parsed.isObject()) {
            throw new IOException("Malformed schema entry in " + file);
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = parsed.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isTextual()) {
                throw new IOException("Schema '" + e.getKey() + "' in " + file + " has a non-text definition");
            }
            out.put(e.getKey(), e.getValue().textValue());
        }
        return out;
    }

    private Map<String, RecordValue.ObjectValue> readRecords(Path file, String schema, JsonNode node) throws IOException {
        if (!node.isObject()) {
            throw new IOException("Records of schema '" + schema + "' in " + file + " are not a JSON object");
        }
        Map<String, RecordValue.ObjectValue> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode value = e.getValue();
            if (value.isObject()) {
                out.put(e.getKey(), (RecordValue.ObjectValue) RecordJson.fromNode(value));
            } else if (value.isTextual()) {
                out.put(e.getKey(), decodeBlob(file, schema, e.getKey(), value.textValue()));
            } else {
                throw new IOException("Record '" + e.getKey() + "' of schema '" + schema + "' in " + file
                        + " is neither an object nor an encoded object");
            }
        }
        return out;
    }

    private static RecordValue.ObjectValue decodeBlob(Path file, String schema, String key, String blob)
            throws IOException {
        try {
            return RecordJson.parseObject(blob);
        } catch (InvalidInputException e) {
            throw new IOException("Record '" + key + "' of schema '" + schema + "' in " + file
                    + " holds an undecodable blob", e);
        }
    }

    private static void deleteQuietly(Path tmp, IOException primary) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }
}
