package io.reclite.core;

import java.util.Objects;

/**
 * First schema mismatch found in a record.
 *
 * @param field        record field that failed
 * @param expectedType type as declared in the schema definition (e.g. "int")
 * @param actualValue  offending value rendered as compact JSON
 */
public record ValidationError(String field, String expectedType, String actualValue) {

    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(expectedType, "expectedType");
        Objects.requireNonNull(actualValue, "actualValue");
    }

    public String describe() {
        return "field '%s' expected %s, got %s".formatted(field, expectedType, actualValue);
    }
}
