package io.reclite.core;

import java.io.IOException;

/**
 * Snapshot read or write failure.
 * <p>
 * When raised by a mutating call the in-memory change has already been applied
 * and is kept: memory may be ahead of disk until the next successful flush.
 */
public final class PersistenceException extends StoreException {

    public PersistenceException(String message, IOException cause) {
        super(ErrorKind.IO_ERROR, message + ": " + cause.getMessage(), cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
