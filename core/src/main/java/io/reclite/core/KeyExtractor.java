// file: src/main/java/io/reclite/core/KeyExtractor.java
package io.reclite.core;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Derives the identity of a new record. Schema-independent.
 * <p>
 * Priority:
 *  1) value of field "id"
 *  2) value of field "name"
 *  3) value of field "key"
 *  4) first textual field value, fields taken in lexicographic name order
 *  5) lexicographically first field name
 *  6) the raw input text, when the record has no fields at all
 * <p>
 * Non-string values picked by 1-3 are stringified with {@link #stringify}.
 * The key becomes the record's permanent identity: re-adding a record that
 * derives the same key replaces the stored one.
 */
public final class KeyExtractor {

    public static final List<String> KEY_FIELDS = List.of("id", "name", "key");

    private KeyExtractor() {
        // utility
    }

    /**
     * @param record   parsed user fields (before any server-side stamping)
     * @param rawInput the text the record was parsed from
     * @throws KeyExtractionException if the derived key is blank
     */
    public static String extract(RecordValue.ObjectValue record, String rawInput) {
        Objects.requireNonNull(record, "record");
        String key = derive(record, rawInput);
        if (key == null || key.isBlank()) {
            throw new KeyExtractionException(
                    "could not extract a valid key from record data: " + rawInput);
        }
        return key;
    }

    private static String derive(RecordValue.ObjectValue record, String rawInput) {
        for (String field : KEY_FIELDS) {
            RecordValue value = record.get(field);
            if (value != null) {
                return stringify(value);
            }
        }
        if (record.isEmpty()) {
            return rawInput;
        }

        TreeMap<String, RecordValue> sorted = new TreeMap<>(record.fields());
        for (Map.Entry<String, RecordValue> e : sorted.entrySet()) {
            if (e.getValue() instanceof RecordValue.TextValue t) {
                return t.value();
            }
        }
        return sorted.firstKey();
    }

    /**
     * Default textual form of a value.
     * Whole floats print without a fraction ("30", not "30.0"); other floats in
     * plain decimal notation; arrays and objects as compact JSON.
     */
    public static String stringify(RecordValue value) {
        if (value instanceof RecordValue.TextValue t) {
            return t.value();
        } else if (value instanceof RecordValue.IntValue i) {
            return Long.toString(i.value());
        } else if (value instanceof RecordValue.FloatValue f) {
            if (Double.isNaN(f.value()) || Double.isInfinite(f.value())) {
                return Double.toString(f.value());
            }
            return new BigDecimal(Double.toString(f.value())).stripTrailingZeros().toPlainString();
        } else if (value instanceof RecordValue.BoolValue b) {
            return Boolean.toString(b.value());
        } else if (value instanceof RecordValue.NullValue) {
            return "null";
        }
        return RecordJson.render(value);
    }
}
