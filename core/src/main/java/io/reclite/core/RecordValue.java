// file: src/main/java/io/reclite/core/RecordValue.java
package io.reclite.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable value tree for a stored record.
 * <p>
 * Variants:
 *  - TextValue:   JSON string
 *  - IntValue:    JSON number without fraction or exponent that fits in a long
 *  - FloatValue:  any other JSON number
 *  - BoolValue:   true / false
 *  - NullValue:   JSON null
 *  - ArrayValue:  ordered list of values
 *  - ObjectValue: field name -> value, insertion ordered
 * <p>
 * A stored record is always an {@link ObjectValue}. Conversion from and to JSON
 * text lives in {@link RecordJson}.
 */
public sealed interface RecordValue
        permits RecordValue.TextValue,
                RecordValue.IntValue,
                RecordValue.FloatValue,
                RecordValue.BoolValue,
                RecordValue.NullValue,
                RecordValue.ArrayValue,
                RecordValue.ObjectValue {

    record TextValue(String value) implements RecordValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record IntValue(long value) implements RecordValue {
    }

    record FloatValue(double value) implements RecordValue {
        /** True when the value has no fractional part (30.0, -2.0). */
        public boolean isWhole() {
            return !Double.isInfinite(value) && value == Math.rint(value);
        }
    }

    record BoolValue(boolean value) implements RecordValue {
    }

    enum NullValue implements RecordValue {
        INSTANCE;
    }

    record ArrayValue(List<RecordValue> elements) implements RecordValue {
        public ArrayValue {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Field map of a record. Field order is the order the fields were supplied in;
     * equality ignores order, as for any {@link Map}.
     */
    record ObjectValue(Map<String, RecordValue> fields) implements RecordValue {
        public ObjectValue {
            Objects.requireNonNull(fields, "fields");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        public RecordValue get(String field) {
            return fields.get(field);
        }

        public boolean has(String field) {
            return fields.containsKey(field);
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        /** Copy of this object with {@code field} set to {@code value} (added last if new). */
        public ObjectValue with(String field, RecordValue value) {
            Map<String, RecordValue> copy = new LinkedHashMap<>(fields);
            copy.put(field, Objects.requireNonNull(value, "value"));
            return new ObjectValue(copy);
        }
    }
}
