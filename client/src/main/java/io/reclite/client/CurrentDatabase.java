package io.reclite.client;

import io.reclite.core.PersistenceException;
import io.reclite.storage.StoreConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Remembers the selected database between CLI invocations in {@code <root>/.current}.
 * Each invocation is a fresh process, so without this "use" would not outlive the command.
 */
final class CurrentDatabase {
    static final String FILE_NAME = ".current";

    private final Path file;

    CurrentDatabase(Path root) {
        this.file = root.resolve(FILE_NAME);
    }

    /** Database recorded by the last "use", or the default one. */
    String read() {
        if (!Files.isRegularFile(file)) {
            return StoreConfig.DEFAULT_DATABASE;
        }
        try {
            String name = Files.readString(file, StandardCharsets.UTF_8).trim();
            return name.isEmpty() ? StoreConfig.DEFAULT_DATABASE : name;
        } catch (IOException e) {
            throw new PersistenceException("failed to read " + file, e);
        }
    }

    void write(String database) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, database + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("failed to record current database in " + file, e);
        }
    }
}
