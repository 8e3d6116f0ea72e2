// file: src/main/java/io/reclite/storage/Snapshot.java
package io.reclite.storage;

import io.reclite.core.RecordValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Complete serializable state of one database at a point in time.
 * <p>
 * Fields:
 *  - records: schema name -> (record key -> record)
 *  - schemas: schema name -> definition string, as typed by the user
 * <p>
 * Both maps are deep-copied on construction and immutable afterwards, so a
 * snapshot handed to {@link Persistence#save} cannot observe later mutations.
 */
public record Snapshot(Map<String, Map<String, RecordValue.ObjectValue>> records,
                       Map<String, String> schemas) {

    /**
     * Name under which schema definitions travel alongside the record maps.
     * No user schema may use it.
     */
    public static final String RESERVED_SCHEMA_NAME = "__schemas__";

    public Snapshot {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(schemas, "schemas");

        Map<String, Map<String, RecordValue.ObjectValue>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, RecordValue.ObjectValue>> e : records.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        records = Collections.unmodifiableMap(copy);
        schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
    }

    public static Snapshot empty() {
        return new Snapshot(Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return records.isEmpty() && schemas.isEmpty();
    }
}
