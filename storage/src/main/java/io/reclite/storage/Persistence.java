package io.reclite.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Boundary between the in-memory engine and the on-disk format.
 * <p>
 * Contract:
 *  - save() replaces the previous contents of {@code file} atomically, or fails
 *    leaving the previous snapshot intact.
 *  - load() returns {@link Snapshot#empty()} when {@code file} does not exist;
 *    any other read or decode problem is an IOException.
 *  - load(save(s)) is equal to s.
 */
public interface Persistence {

    void save(Path file, Snapshot snapshot) throws IOException;

    Snapshot load(Path file) throws IOException;
}
