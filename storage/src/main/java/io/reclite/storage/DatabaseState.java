// file: src/main/java/io/reclite/storage/DatabaseState.java
package io.reclite.storage;

import io.reclite.core.PartialKeyIndex;
import io.reclite.core.RecordValue;
import io.reclite.core.SchemaDefinition;
import io.reclite.core.SchemaValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory contents of one database: schemas, records and the partial-key
 * index of every schema.
 * <p>
 * Invariants:
 *  - every schema has a (possibly empty) record map and an index,
 *  - each index holds exactly the keys of its schema's record map; all record
 *    mutations go through {@link #putRecord} / {@link #removeRecord}.
 * <p>
 * Not thread-safe; {@link StorageEngine} serializes access.
 */
final class DatabaseState {

    private final String name;
    private final Map<String, SchemaDefinition> schemas = new TreeMap<>();
    private final Map<String, Map<String, RecordValue.ObjectValue>> records = new TreeMap<>();
    private final Map<String, PartialKeyIndex> indexes = new TreeMap<>();

    DatabaseState(String name) {
        this.name = name;
    }

    /**
     * Seed a state from a loaded snapshot and rebuild every index wholesale.
     * Record maps whose schema has no definition are kept so a later save does
     * not drop them.
     */
    static DatabaseState fromSnapshot(String name, Snapshot snapshot, SchemaValidator parser) {
        DatabaseState state = new DatabaseState(name);
        for (Map.Entry<String, String> e : snapshot.schemas().entrySet()) {
            state.schemas.put(e.getKey(), parser.define(e.getKey(), e.getValue()));
        }
        for (Map.Entry<String, Map<String, RecordValue.ObjectValue>> e : snapshot.records().entrySet()) {
            state.records.put(e.getKey(), new TreeMap<>(e.getValue()));
        }
        for (String schema : state.schemas.keySet()) {
            state.records.computeIfAbsent(schema, s -> new TreeMap<>());
        }
        for (Map.Entry<String, Map<String, RecordValue.ObjectValue>> e : state.records.entrySet()) {
            state.indexes.put(e.getKey(), PartialKeyIndex.rebuild(e.getValue().keySet()));
        }
        return state;
    }

    String name() {
        return name;
    }

    boolean hasSchema(String schema) {
        return schemas.containsKey(schema);
    }

    Optional<SchemaDefinition> schema(String schema) {
        return Optional.ofNullable(schemas.get(schema));
    }

    List<String> schemaNames() {
        return new ArrayList<>(schemas.keySet());
    }

    /** Upsert a schema; existing records are left as they are. */
    void putSchema(SchemaDefinition definition) {
        schemas.put(definition.name(), definition);
        records.computeIfAbsent(definition.name(), s -> new TreeMap<>());
        indexes.computeIfAbsent(definition.name(), s -> new PartialKeyIndex());
    }

    /** Records of a schema, sorted by key. Empty if the schema has none. */
    Map<String, RecordValue.ObjectValue> records(String schema) {
        Map<String, RecordValue.ObjectValue> byKey = records.get(schema);
        return byKey == null ? Map.of() : Collections.unmodifiableMap(byKey);
    }

    Optional<RecordValue.ObjectValue> record(String schema, String key) {
        Map<String, RecordValue.ObjectValue> byKey = records.get(schema);
        return byKey == null ? Optional.empty() : Optional.ofNullable(byKey.get(key));
    }

    /** Store or replace a record and index its key. Returns the replaced record, if any. */
    Optional<RecordValue.ObjectValue> putRecord(String schema, String key, RecordValue.ObjectValue value) {
        RecordValue.ObjectValue previous = records.computeIfAbsent(schema, s -> new TreeMap<>()).put(key, value);
        index(schema).insert(key);
        return Optional.ofNullable(previous);
    }

    /** Remove a record by exact key and unindex it. Returns false if there was none. */
    boolean removeRecord(String schema, String key) {
        Map<String, RecordValue.ObjectValue> byKey = records.get(schema);
        if (byKey == null || byKey.remove(key) == null) {
            return false;
        }
        index(schema).remove(key);
        return true;
    }

    /** Index of a schema for read paths; never creates one. */
    Optional<PartialKeyIndex> findIndex(String schema) {
        return Optional.ofNullable(indexes.get(schema));
    }

    PartialKeyIndex index(String schema) {
        return indexes.computeIfAbsent(schema, s -> new PartialKeyIndex());
    }

    void clear() {
        schemas.clear();
        records.clear();
        indexes.clear();
    }

    Snapshot toSnapshot() {
        Map<String, String> definitions = new TreeMap<>();
        for (SchemaDefinition definition : schemas.values()) {
            definitions.put(definition.name(), definition.definition());
        }
        return new Snapshot(records, definitions);
    }
}
