package io.reclite.core;

import java.util.Objects;

/**
 * Thrown when a record does not conform to its schema.
 * Carries the first mismatch found; mismatches are never aggregated.
 */
public final class ValidationFailedException extends StoreException {
    private final ValidationError error;

    public ValidationFailedException(ValidationError error) {
        super(ErrorKind.VALIDATION_FAILED, "record validation failed: " + error.describe());
        this.error = Objects.requireNonNull(error, "error");
    }

    public ValidationError error() {
        return error;
    }
}
