// file: src/main/java/io/reclite/storage/StorageEngine.java
package io.reclite.storage;

import io.reclite.core.AmbiguousKeyException;
import io.reclite.core.InvalidInputException;
import io.reclite.core.KeyExtractor;
import io.reclite.core.NotFoundException;
import io.reclite.core.PersistenceException;
import io.reclite.core.RecordJson;
import io.reclite.core.RecordValue;
import io.reclite.core.SchemaDefinition;
import io.reclite.core.SchemaPolicy;
import io.reclite.core.SchemaValidator;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Schema-validated record store over one snapshot file per database.
 * <p>
 * Responsibilities:
 *  - Own every {@link DatabaseState} and the name of the current database.
 *  - Validate requests (schema existence, JSON shape, schema types, key).
 *  - Keep records and their partial-key indexes in step.
 *  - Flush the whole current database through {@link Persistence} after each mutation.
 * <p>
 * Concurrency:
 *  - One read/write lock guards all state, including the current-database pointer.
 *  - Reads (getSchema, listSchemas, getRecord, listRecords) share the read lock.
 *  - Mutations hold the write lock for their full duration, flush included.
 * <p>
 * Durability:
 *  - A mutation is applied in memory first, then flushed.
 *  - If the flush fails a {@link PersistenceException} is thrown and the in-memory
 *    change is kept (memory is ahead of disk). Retrying the same add/delete is safe.
 * <p>
 * Database switching:
 *  - useDatabase flushes the outgoing database, then activates the target,
 *    loading it from disk (or starting empty) if it is not in memory.
 *  - A flushed outgoing database is evicted; one whose flush failed stays in
 *    memory and is flushed again on reactivation or {@link #close()}.
 */
public final class StorageEngine implements AutoCloseable {
    private static final Logger log = Logger.getLogger(StorageEngine.class.getName());

    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    private final StoreConfig config;
    private final Persistence persistence;
    private final Clock clock;
    private final SchemaValidator validator;

    // Persisted definitions were accepted when created; re-parse them leniently
    // so a stricter policy at startup cannot make a database unloadable.
    private final SchemaValidator loader = new SchemaValidator(SchemaPolicy.PERMISSIVE);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, DatabaseState> loaded = new LinkedHashMap<>();
    private String current;

    public StorageEngine(StoreConfig config) {
        this(config, new JsonFilePersistence(), Clock.systemUTC());
    }

    /**
     * @param config      root directory, default database, file name, schema policy
     * @param persistence snapshot reader/writer
     * @param clock       source of created_at / updated_at stamps
     * @throws PersistenceException if the default database exists but cannot be read
     */
    public StorageEngine(StoreConfig config, Persistence persistence, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.validator = new SchemaValidator(config.schemaPolicy());

        String initial = requireDatabaseName(config.defaultDatabase());
        loaded.put(initial, load(initial));
        this.current = initial;
    }

    // ---------------------------------------------------------------- schemas

    /**
     * Create or replace a schema. Existing records are not revalidated.
     *
     * @param fields whitespace-separated {@code field:type} tokens
     */
    public SchemaDefinition createSchema(String name, String fields) {
        requireSchemaName(name);
        Objects.requireNonNull(fields, "fields");

        lock.writeLock().lock();
        try {
            SchemaDefinition definition = validator.define(name, fields);
            state().putSchema(definition);
            log.log(Level.FINE, "Schema {0} defined in {1}: {2}", new Object[]{name, current, fields});
            flush();
            return definition;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Definition string of a schema, as it was given. */
    public String getSchema(String name) {
        lock.readLock().lock();
        try {
            return requireSchema(name).definition();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Schema names of the current database, sorted. */
    public List<String> listSchemas() {
        lock.readLock().lock();
        try {
            return List.copyOf(state().schemaNames());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------- records

    /**
     * Parse, stamp, validate and store a record, replacing any record with the same key.
     * <p>
     * Steps:
     *  1) Parse {@code json}; it must be a single JSON object.
     *  2) Set created_at and updated_at to the current time.
     *  3) Validate the stamped record against the schema.
     *  4) Derive the key from the user-supplied fields ({@link KeyExtractor}).
     *  5) Store, index, flush.
     */
    public StoredRecord addRecord(String schema, String json) {
        lock.writeLock().lock();
        try {
            SchemaDefinition definition = requireSchema(schema);
            RecordValue.ObjectValue parsed = RecordJson.parseObject(json);

            RecordValue.TextValue now = new RecordValue.TextValue(timestamp());
            RecordValue.ObjectValue stamped = parsed.with(CREATED_AT, now).with(UPDATED_AT, now);

            validator.requireValid(definition, stamped);
            String key = KeyExtractor.extract(parsed, json);

            boolean replaced = state().putRecord(schema, key, stamped).isPresent();
            log.log(Level.FINE, "{0} record {1} in {2}.{3}",
                    new Object[]{replaced ? "Replaced" : "Added", key, current, schema});
            flush();
            return new StoredRecord(key, stamped);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Fetch a record by exact key, falling back to a partial (prefix) key.
     * An exact match always wins, even if the key is also a prefix of other keys.
     *
     * @throws NotFoundException     if the schema is unknown or nothing matches
     * @throws AmbiguousKeyException if the partial key matches several records
     */
    public StoredRecord getRecord(String schema, String key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            requireSchema(schema);
            DatabaseState state = state();

            var exact = state.record(schema, key);
            if (exact.isPresent()) {
                return new StoredRecord(key, exact.get());
            }

            List<String> matches = state.findIndex(schema)
                    .map(index -> index.lookup(key))
                    .orElse(List.of());
            if (matches.isEmpty()) {
                throw NotFoundException.record(schema, key);
            }
            if (matches.size() > 1) {
                throw new AmbiguousKeyException(schema, key, matches);
            }
            String fullKey = matches.get(0);
            RecordValue.ObjectValue value = state.record(schema, fullKey)
                    .orElseThrow(() -> new IllegalStateException(
                            "index of %s.%s holds unknown key %s".formatted(current, schema, fullKey)));
            return new StoredRecord(fullKey, value);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Delete by exact key only. Partial keys are never resolved here.
     *
     * @throws NotFoundException if the schema or the exact key is unknown
     */
    public void deleteRecord(String schema, String key) {
        Objects.requireNonNull(key, "key");
        lock.writeLock().lock();
        try {
            requireSchema(schema);
            if (!state().removeRecord(schema, key)) {
                throw NotFoundException.record(schema, key);
            }
            log.log(Level.FINE, "Deleted record {0} from {1}.{2}", new Object[]{key, current, schema});
            flush();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** All records of a schema, sorted by key. */
    public List<StoredRecord> listRecords(String schema) {
        lock.readLock().lock();
        try {
            requireSchema(schema);
            List<StoredRecord> out = new ArrayList<>();
            for (Map.Entry<String, RecordValue.ObjectValue> e : state().records(schema).entrySet()) {
                out.add(new StoredRecord(e.getKey(), e.getValue()));
            }
            return Collections.unmodifiableList(out);
        } finally {
            lock.readLock().unlock();
        }
    }

    // -------------------------------------------------------------- databases

    public String currentDatabase() {
        lock.readLock().lock();
        try {
            return current;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Switch the current database.
     * <p>
     * A failed flush of the outgoing database does not stop the switch: it is
     * logged and the outgoing state stays in memory until it can be flushed.
     *
     * @throws InvalidInputException if {@code name} is not a usable directory name
     * @throws PersistenceException  if the target's snapshot exists but cannot be read;
     *                               the current database is then unchanged
     */
    public void useDatabase(String name) {
        requireDatabaseName(name);
        lock.writeLock().lock();
        try {
            DatabaseState outgoing = state();
            boolean outgoingFlushed = tryFlush(outgoing);

            if (name.equals(current)) {
                return;
            }

            DatabaseState incoming = loaded.get(name);
            if (incoming == null) {
                incoming = load(name);
                loaded.put(name, incoming);
            } else if (!tryFlush(incoming)) {
                log.log(Level.WARNING, "Database {0} is still ahead of disk", name);
            }

            if (outgoingFlushed) {
                loaded.remove(outgoing.name());
            }
            current = name;
            log.log(Level.INFO, "Switched to database {0}", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Subdirectories of the root, sorted. A missing root means no databases. */
    public List<String> listDatabases() {
        Path root = config.root();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path entry : entries) {
                out.add(entry.getFileName().toString());
            }
        } catch (IOException e) {
            throw new PersistenceException("failed to read storage directory " + root, e);
        }
        Collections.sort(out);
        return out;
    }

    /** Drop every schema and record of the current database and persist the empty state. */
    public void wipeDatabase() {
        lock.writeLock().lock();
        try {
            state().clear();
            log.log(Level.INFO, "Wiped database {0}", current);
            flush();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Flush the current database and any database still waiting for a flush.
     *
     * @throws PersistenceException for the first failed flush (others are suppressed)
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            PersistenceException failure = null;
            for (DatabaseState state : new ArrayList<>(loaded.values())) {
                try {
                    save(state);
                } catch (PersistenceException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** True if the database is held in memory. */
    boolean isLoaded(String name) {
        lock.readLock().lock();
        try {
            return loaded.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------- helpers

    private DatabaseState state() {
        return loaded.get(current);
    }

    private SchemaDefinition requireSchema(String name) {
        Objects.requireNonNull(name, "schema");
        return state().schema(name).orElseThrow(() -> NotFoundException.schema(name));
    }

    private DatabaseState load(String name) {
        Path file = config.databaseFile(name);
        try {
            Files.createDirectories(file.getParent());
            Snapshot snapshot = persistence.load(file);
            DatabaseState state = DatabaseState.fromSnapshot(name, snapshot, loader);
            log.log(Level.INFO, "Loaded database {0} ({1} schemas) from {2}",
                    new Object[]{name, snapshot.schemas().size(), file});
            return state;
        } catch (IOException e) {
            throw new PersistenceException("failed to load database '" + name + "'", e);
        }
    }

    private void flush() {
        save(state());
    }

    private void save(DatabaseState state) {
        Path file = config.databaseFile(state.name());
        try {
            persistence.save(file, state.toSnapshot());
        } catch (IOException e) {
            log.log(Level.WARNING, "Flush of database " + state.name() + " failed; memory is ahead of disk", e);
            throw new PersistenceException("failed to save database '" + state.name() + "'", e);
        }
    }

    private boolean tryFlush(DatabaseState state) {
        try {
            save(state);
            return true;
        } catch (PersistenceException e) {
            return false;
        }
    }

    private String timestamp() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    private static void requireSchemaName(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new InvalidInputException("schema name must not be blank");
        }
        if (Snapshot.RESERVED_SCHEMA_NAME.equals(name)) {
            throw new InvalidInputException("schema name '" + name + "' is reserved");
        }
    }

    private static String requireDatabaseName(String name) {
        Objects.requireNonNull(name, "database");
        if (name.isBlank() || name.equals(".") || name.equals("..")
                || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0 || name.indexOf('\0') >= 0) {
            throw new InvalidInputException("invalid database name '" + name + "'");
        }
        return name;
    }
}
