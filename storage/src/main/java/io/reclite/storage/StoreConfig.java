// file: src/main/java/io/reclite/storage/StoreConfig.java
package io.reclite.storage;

import io.reclite.core.SchemaPolicy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Storage engine configuration.
 * <p>
 *  - root:            directory holding one subdirectory per database
 *  - defaultDatabase: database selected when the engine starts
 *  - fileName:        snapshot file name inside each database directory
 *  - schemaPolicy:    how forgiving schema definitions are
 * <p>
 * Layout on disk: {@code <root>/<database>/<fileName>}.
 */
public record StoreConfig(Path root, String defaultDatabase, String fileName, SchemaPolicy schemaPolicy) {

    public static final Path DEFAULT_ROOT = Path.of("dbs");
    public static final String DEFAULT_DATABASE = "default";
    public static final String DEFAULT_FILE_NAME = "store.json";

    public StoreConfig {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(defaultDatabase, "defaultDatabase");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(schemaPolicy, "schemaPolicy");
        if (fileName.isBlank()) throw new IllegalArgumentException("fileName must not be blank");
    }

    /** ./dbs, database "default", store.json, permissive schemas. */
    public static StoreConfig defaults() {
        return new StoreConfig(DEFAULT_ROOT, DEFAULT_DATABASE, DEFAULT_FILE_NAME, SchemaPolicy.PERMISSIVE);
    }

    public StoreConfig withRoot(Path root) {
        return new StoreConfig(root, defaultDatabase, fileName, schemaPolicy);
    }

    public StoreConfig withDefaultDatabase(String defaultDatabase) {
        return new StoreConfig(root, defaultDatabase, fileName, schemaPolicy);
    }

    public StoreConfig withSchemaPolicy(SchemaPolicy schemaPolicy) {
        return new StoreConfig(root, defaultDatabase, fileName, schemaPolicy);
    }

    /** Snapshot file of {@code database}. */
    public Path databaseFile(String database) {
        return root.resolve(database).resolve(fileName);
    }
}
