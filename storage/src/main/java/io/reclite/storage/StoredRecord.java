package io.reclite.storage;

import io.reclite.core.RecordValue;

import java.util.Objects;

/** A record together with the key it is stored under. */
public record StoredRecord(String key, RecordValue.ObjectValue value) {

    public StoredRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
