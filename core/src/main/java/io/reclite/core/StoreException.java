package io.reclite.core;

import java.util.Objects;

/**
 * Base class of every error the record store reports to its caller.
 * <p>
 * Errors are unchecked and never retried internally; the caller decides.
 * The message is a single line suitable for printing as-is.
 */
public class StoreException extends RuntimeException {
    private final ErrorKind kind;

    public StoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public StoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
