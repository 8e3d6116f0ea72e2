package io.reclite.storage;

import io.reclite.core.AmbiguousKeyException;
import io.reclite.core.ErrorKind;
import io.reclite.core.InvalidInputException;
import io.reclite.core.KeyExtractionException;
import io.reclite.core.NotFoundException;
import io.reclite.core.PersistenceException;
import io.reclite.core.RecordValue;
import io.reclite.core.SchemaPolicy;
import io.reclite.core.ValidationFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StorageEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir Path root;

    private FlakyPersistence persistence;
    private StorageEngine engine;

    @BeforeEach
    void setUp() {
        persistence = new FlakyPersistence();
        engine = open();
        engine.createSchema("User", "name:string age:int");
    }

    private StorageEngine open() {
        return new StorageEngine(StoreConfig.defaults().withRoot(root), persistence, CLOCK);
    }

    private static String text(StoredRecord rec, String field) {
        return ((RecordValue.TextValue) rec.value().get(field)).value();
    }

    // ------------------------------------------------------------- scenarios

    @Test
    void partial_key_that_matches_two_records_is_ambiguous_and_exact_key_wins() {
        assertEquals("Alice", engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}").key());
        assertEquals("Alicia", engine.addRecord("User", "{\"name\":\"Alicia\",\"age\":28}").key());

        var e = assertThrows(AmbiguousKeyException.class, () -> engine.getRecord("User", "Ali"));
        assertEquals(ErrorKind.AMBIGUOUS_KEY, e.kind());
        assertEquals(List.of("Alice", "Alicia"), e.candidates());

        var alice = engine.getRecord("User", "Alice");
        assertEquals("Alice", alice.key());
        assertEquals(new RecordValue.IntValue(30), alice.value().get("age"));
    }

    @Test
    void unique_partial_key_resolves_to_the_record() {
        engine.addRecord("User", "{\"name\":\"Bob\",\"age\":25}");

        var bob = engine.getRecord("User", "Bo");
        assertEquals("Bob", bob.key());
        assertEquals("Bob", text(bob, "name"));
    }

    @Test
    void exact_key_wins_even_when_it_prefixes_other_keys() {
        engine.addRecord("User", "{\"name\":\"Al\"}");
        engine.addRecord("User", "{\"name\":\"Alice\"}");
        engine.addRecord("User", "{\"name\":\"Alicia\"}");

        assertEquals("Al", engine.getRecord("User", "Al").key());
        assertEquals("Alice", engine.getRecord("User", "Alice").key());
    }

    @Test
    void partial_lookup_with_long_prefix_filters_bucket() {
        engine.addRecord("User", "{\"name\":\"Alexander\"}");
        engine.addRecord("User", "{\"name\":\"Alexandra\"}");

        assertEquals("Alexandra", engine.getRecord("User", "Alexandra").key());
        assertEquals("Alexander", engine.getRecord("User", "Alexande").key());
        assertThrows(AmbiguousKeyException.class, () -> engine.getRecord("User", "Alexand"));
        assertThrows(NotFoundException.class, () -> engine.getRecord("User", "Alexis"));
    }

    @Test
    void delete_requires_an_exact_key() {
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}");

        var e = assertThrows(NotFoundException.class, () -> engine.deleteRecord("User", "Ali"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        assertEquals("Alice", engine.getRecord("User", "Ali").key());

        engine.deleteRecord("User", "Alice");
        assertThrows(NotFoundException.class, () -> engine.getRecord("User", "Ali"));
        assertThrows(NotFoundException.class, () -> engine.deleteRecord("User", "Alice"));
    }

    @Test
    void wipe_clears_schemas_too() {
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}");

        engine.wipeDatabase();

        assertThrows(NotFoundException.class, () -> engine.listRecords("User"));
        assertEquals(List.of(), engine.listSchemas());

        var reopened = open();
        assertEquals(List.of(), reopened.listSchemas());
    }

    @Test
    void adding_the_same_json_twice_stores_one_record() {
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}");
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}");

        assertEquals(1, engine.listRecords("User").size());
    }

    @Test
    void re_adding_under_the_same_key_replaces_the_whole_record() {
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30,\"email\":\"a@x\"}");
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":31}");

        var alice = engine.getRecord("User", "Alice");
        assertEquals(new RecordValue.IntValue(31), alice.value().get("age"));
        assertFalse(alice.value().has("email"));
    }

    // ------------------------------------------------------------ validation

    @Test
    void add_stamps_timestamps_from_the_clock() {
        var stored = engine.addRecord("User", "{\"name\":\"Alice\"}");

        assertEquals("2024-05-01T10:00:00Z", text(stored, StorageEngine.CREATED_AT));
        assertEquals("2024-05-01T10:00:00Z", text(stored, StorageEngine.UPDATED_AT));
        assertEquals(stored, engine.getRecord("User", "Alice"));
    }

    @Test
    void add_rejects_type_mismatches_and_stores_nothing() {
        var e = assertThrows(ValidationFailedException.class,
                () -> engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30.5}"));
        assertEquals("age", e.error().field());
        assertEquals("int", e.error().expectedType());
        assertEquals("30.5", e.error().actualValue());

        assertEquals(List.of(), engine.listRecords("User"));
    }

    @Test
    void timestamps_are_validated_like_any_other_field() {
        engine.createSchema("Event", "created_at:int");

        assertThrows(ValidationFailedException.class, () -> engine.addRecord("Event", "{\"id\":1}"));
    }

    @Test
    void add_rejects_malformed_json_and_non_objects() {
        for (String bad : List.of("{\"name\":", "[1]", "not json", "")) {
            var e = assertThrows(InvalidInputException.class, () -> engine.addRecord("User", bad), bad);
            assertEquals(ErrorKind.INVALID_INPUT, e.kind());
        }
    }

    @Test
    void add_to_unknown_schema_is_not_found_before_json_is_parsed() {
        var e = assertThrows(NotFoundException.class, () -> engine.addRecord("Nope", "garbage"));
        assertEquals("schema 'Nope' does not exist", e.getMessage());
    }

    @Test
    void record_without_usable_key_is_rejected() {
        assertThrows(KeyExtractionException.class, () -> engine.addRecord("User", "{\"name\":\"\"}"));
        assertEquals(List.of(), engine.listRecords("User"));
    }

    @Test
    void key_falls_back_to_textual_field_then_field_name_then_raw_input() {
        engine.createSchema("Misc", "");

        assertEquals("hello", engine.addRecord("Misc", "{\"zz\":1,\"greeting\":\"hello\"}").key());
        assertEquals("count", engine.addRecord("Misc", "{\"count\":1}").key());
        assertEquals("{}", engine.addRecord("Misc", "{}").key());
        assertEquals("42", engine.addRecord("Misc", "{\"id\":42}").key());
    }

    // --------------------------------------------------------------- schemas

    @Test
    void schema_definitions_are_returned_verbatim_and_listed_sorted() {
        engine.createSchema("Order", "id:int total:float");

        assertEquals("name:string age:int", engine.getSchema("User"));
        assertEquals(List.of("Order", "User"), engine.listSchemas());
        assertThrows(NotFoundException.class, () -> engine.getSchema("Nope"));
    }

    @Test
    void redefining_a_schema_does_not_revalidate_existing_records() {
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}");

        engine.createSchema("User", "age:string");

        assertEquals("Alice", engine.getRecord("User", "Alice").key());
        assertThrows(ValidationFailedException.class,
                () -> engine.addRecord("User", "{\"name\":\"Bob\",\"age\":30}"));
    }

    @Test
    void reserved_and_blank_schema_names_are_rejected() {
        assertThrows(InvalidInputException.class, () -> engine.createSchema("__schemas__", "a:int"));
        assertThrows(InvalidInputException.class, () -> engine.createSchema(" ", "a:int"));
    }

    @Test
    void strict_policy_rejects_bad_tokens_but_still_loads_lenient_files() {
        engine.createSchema("Loose", "when:timestamp junk");

        var strict = new StorageEngine(
                StoreConfig.defaults().withRoot(root).withSchemaPolicy(SchemaPolicy.STRICT), persistence, CLOCK);

        assertEquals("when:timestamp junk", strict.getSchema("Loose"));
        assertThrows(InvalidInputException.class, () -> strict.createSchema("Other", "junk"));
        assertThrows(InvalidInputException.class, () -> strict.createSchema("Other", "when:timestamp"));
    }

    // ----------------------------------------------------------- persistence

    @Test
    void state_survives_reopening() {
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}");
        engine.addRecord("User", "{\"name\":\"Alicia\",\"age\":28}");

        var reopened = open();

        assertEquals("name:string age:int", reopened.getSchema("User"));
        assertEquals(engine.listRecords("User"), reopened.listRecords("User"));
        assertThrows(AmbiguousKeyException.class, () -> reopened.getRecord("User", "Ali"));
        assertTrue(Files.exists(root.resolve("default").resolve("store.json")));
    }

    @Test
    void failed_flush_keeps_the_in_memory_change() {
        persistence.failSaves = true;

        var e = assertThrows(PersistenceException.class,
                () -> engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}"));
        assertEquals(ErrorKind.IO_ERROR, e.kind());
        assertEquals("disk full (simulated)", e.getCause().getMessage());

        // memory is ahead of disk
        assertEquals("Alice", engine.getRecord("User", "Alice").key());
        assertThrows(NotFoundException.class, () -> open().getRecord("User", "Alice"));

        // retrying once the disk recovers converges
        persistence.failSaves = false;
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}");
        assertEquals("Alice", open().getRecord("User", "Alice").key());
    }

    @Test
    void failed_flush_on_delete_keeps_the_delete() {
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}");
        persistence.failSaves = true;

        assertThrows(PersistenceException.class, () -> engine.deleteRecord("User", "Alice"));
        assertThrows(NotFoundException.class, () -> engine.getRecord("User", "Alice"));
    }

    // ------------------------------------------------------------- databases

    @Test
    void databases_are_isolated_and_reload_from_disk() {
        engine.addRecord("User", "{\"name\":\"Alice\",\"age\":30}");

        engine.useDatabase("other");
        assertEquals("other", engine.currentDatabase());
        assertEquals(List.of(), engine.listSchemas());
        assertThrows(NotFoundException.class, () -> engine.getRecord("User", "Alice"));
        assertFalse(engine.isLoaded("default"));

        engine.createSchema("Item", "sku:string");
        engine.addRecord("Item", "{\"sku\":\"X-1\"}");

        engine.useDatabase("default");
        assertTrue(engine.isLoaded("default"));
        assertFalse(engine.isLoaded("other"));
        assertEquals("Alice", engine.getRecord("User", "Alice").key());
        assertThrows(NotFoundException.class, () -> engine.getSchema("Item"));

        assertEquals(List.of("default", "other"), engine.listDatabases());
    }

    @Test
    void switching_to_the_current_database_is_a_flush() {
        engine.addRecord("User", "{\"name\":\"Alice\"}");
        int before = persistence.savedFiles.size();

        engine.useDatabase("default");

        assertEquals("default", engine.currentDatabase());
        assertEquals(before + 1, persistence.savedFiles.size());
        assertEquals("Alice", engine.getRecord("User", "Alice").key());
    }

    @Test
    void outgoing_database_that_fails_to_flush_stays_in_memory() {
        persistence.failSaves = true;
        assertThrows(PersistenceException.class, () -> engine.addRecord("User", "{\"name\":\"Alice\"}"));

        engine.useDatabase("other");
        assertEquals("other", engine.currentDatabase());
        assertTrue(engine.isLoaded("default"));

        persistence.failSaves = false;
        engine.useDatabase("default");
        assertEquals("Alice", engine.getRecord("User", "Alice").key());
        assertEquals("Alice", open().getRecord("User", "Alice").key());
    }

    @Test
    void unreadable_target_leaves_current_database_unchanged() {
        persistence.failLoads = true;

        var e = assertThrows(PersistenceException.class, () -> engine.useDatabase("broken"));
        assertEquals(ErrorKind.IO_ERROR, e.kind());
        assertEquals("default", engine.currentDatabase());
        assertEquals("name:string age:int", engine.getSchema("User"));
    }

    @Test
    void invalid_database_names_are_rejected() {
        for (String bad : List.of("", " ", ".", "..", "a/b", "a\\b")) {
            assertThrows(InvalidInputException.class, () -> engine.useDatabase(bad), bad);
        }
        assertEquals("default", engine.currentDatabase());
    }

    @Test
    void list_databases_ignores_plain_files() throws Exception {
        Files.writeString(root.resolve(".current"), "default");
        assertEquals(List.of("default"), engine.listDatabases());
    }

    @Test
    void close_flushes_databases_still_waiting_for_a_flush() {
        persistence.failSaves = true;
        assertThrows(PersistenceException.class, () -> engine.addRecord("User", "{\"name\":\"Alice\"}"));
        engine.useDatabase("other");

        persistence.failSaves = false;
        engine.close();

        assertEquals("Alice", open().getRecord("User", "Alice").key());
    }

    // ----------------------------------------------------------- concurrency

    @Test
    void concurrent_writers_and_readers_keep_index_consistent() throws Exception {
        int threads = 4;
        int perThread = 25;
        Thread[] workers = new Thread[threads];
        Throwable[] failures = new Throwable[threads];

        for (int t = 0; t < threads; t++) {
            final int id = t;
            workers[t] = new Thread(() -> {
                try {
                    for (int i = 0; i < perThread; i++) {
                        String name = "user-" + id + "-" + i;
                        engine.addRecord("User", "{\"name\":\"" + name + "\"}");
                        assertEquals(name, engine.getRecord("User", name).key());
                        engine.listRecords("User");
                    }
                } catch (Throwable e) {
                    failures[id] = e;
                }
            });
            workers[t].start();
        }
        for (Thread w : workers) {
            w.join();
        }
        for (Throwable f : failures) {
            assertNull(f);
        }

        assertEquals(threads * perThread, engine.listRecords("User").size());
        assertEquals(threads * perThread, open().listRecords("User").size());
    }
}
