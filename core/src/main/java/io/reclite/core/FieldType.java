package io.reclite.core;

/**
 * Field types a schema definition can declare.
 * <p>
 * Recognised spellings (exact match, lower case):
 *   string | int, integer | float, double | bool, boolean | object, json.
 * Any other spelling, including {@code Int} or {@code STRING}, maps to UNKNOWN.
 */
public enum FieldType {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    /** Accepts any value. */
    OBJECT,
    /** Unrecognised type name; accepts any value under the permissive policy. */
    UNKNOWN;

    public static FieldType fromName(String name) {
        return switch (name) {
            case "string" -> STRING;
            case "int", "integer" -> INTEGER;
            case "float", "double" -> FLOAT;
            case "bool", "boolean" -> BOOLEAN;
            case "object", "json" -> OBJECT;
            default -> UNKNOWN;
        };
    }

    /** True if a value of this variant satisfies the type. */
    public boolean accepts(RecordValue value) {
        return switch (this) {
            case STRING -> value instanceof RecordValue.TextValue;
            case INTEGER -> value instanceof RecordValue.IntValue
                    || (value instanceof RecordValue.FloatValue f && f.isWhole());
            case FLOAT -> value instanceof RecordValue.IntValue
                    || value instanceof RecordValue.FloatValue;
            case BOOLEAN -> value instanceof RecordValue.BoolValue;
            case OBJECT, UNKNOWN -> true;
        };
    }
}
