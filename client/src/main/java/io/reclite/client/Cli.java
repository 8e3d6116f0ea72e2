// file: client/src/main/java/io/reclite/client/Cli.java
package io.reclite.client;

import io.reclite.core.RecordJson;
import io.reclite.core.StoreException;
import io.reclite.storage.StorageEngine;
import io.reclite.storage.StoredRecord;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line front end over {@link StorageEngine}.
 *
 * Usage:
 *   reclite [options] schema [name [field:type ...]]
 *   reclite [options] add <schema> <json>
 *   reclite [options] get|view <schema> <key>
 *   reclite [options] delete <schema> <key>
 *   reclite [options] list <schema>
 *   reclite [options] use <database>
 *   reclite [options] dbs
 *   reclite [options] wipe|drop
 *
 * Examples:
 *   reclite schema User name:string age:int email:string
 *   reclite add User '{"name":"Alice","age":30}'
 *   reclite get User Ali
 *
 * Exit codes: 0 on success, 1 on a reported error (message on stdout),
 * 2 on an unexpected failure (stack trace on stderr).
 */
public final class Cli {

    private static final String USAGE = """
            Usage:
              reclite [options] schema                          - List schemas
              reclite [options] schema <name>                   - View a schema
              reclite [options] schema <name> <field:type>...   - Create or replace a schema
              reclite [options] add <schema> <json>             - Add a record
              reclite [options] get|view <schema> <key>         - Get a record by key or key prefix
              reclite [options] delete <schema> <key>           - Delete a record by exact key
              reclite [options] list <schema>                   - List all records of a schema
              reclite [options] use <database>                  - Switch to a different database
              reclite [options] dbs                             - List all databases
              reclite [options] wipe|drop                       - Wipe the current database

            Options:
              --root, -r <dir>   Storage root (default: ./dbs)
              --strict-schemas   Reject malformed schema tokens and unknown types
              --verbose, -v      Log engine activity to stderr
              --help, -h         Show this help message

            Examples:
              reclite schema User name:string age:int email:string
              reclite add User '{"name":"Alice", "age":30, "email":"alice@example.com"}'
              reclite get User Alice
              reclite list User
              reclite delete User Alice
              reclite use my_database
            """;

    private final StorageEngine engine;
    private final CurrentDatabase currentDatabase;
    private final PrintStream out;

    Cli(StorageEngine engine, CurrentDatabase currentDatabase, PrintStream out) {
        this.engine = engine;
        this.currentDatabase = currentDatabase;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Parse, execute and report one command. Returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            CliOptions options = CliOptions.parse(args);
            if (options.help()) {
                out.print(USAGE);
                return 0;
            }
            if (options.command().isEmpty()) {
                throw new CliException("missing command");
            }
            configureLogging(options.verbose());

            var marker = new CurrentDatabase(options.root());
            var engine = new StorageEngine(options.storeConfig(marker.read()));
            new Cli(engine, marker, out).execute(options.command());
            return 0;
        } catch (CliException e) {
            out.println("Error: " + e.getMessage());
            out.print(USAGE);
            return 1;
        } catch (StoreException e) {
            out.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    void execute(List<String> words) {
        String cmd = words.get(0).toLowerCase(Locale.ROOT);
        List<String> args = words.subList(1, words.size());

        switch (cmd) {
            case "schema" -> schema(args);
            case "add" -> {
                require(args, 2, "add requires <schema> <json>");
                // unquoted JSON arrives split on spaces; glue it back together
                String json = String.join(" ", args.subList(1, args.size()));
                StoredRecord stored = engine.addRecord(args.get(0), json);
                out.println("Record added successfully (key: " + stored.key() + ")");
            }
            case "get", "view" -> {
                require(args, 2, cmd + " requires <schema> <key>");
                out.println(RecordJson.render(engine.getRecord(args.get(0), args.get(1)).value()));
            }
            case "delete" -> {
                require(args, 2, "delete requires <schema> <key>");
                engine.deleteRecord(args.get(0), args.get(1));
                out.println("Record deleted successfully");
            }
            case "list" -> {
                require(args, 1, "list requires <schema>");
                for (StoredRecord rec : engine.listRecords(args.get(0))) {
                    out.println(RecordJson.render(rec.value()));
                }
            }
            case "use" -> {
                require(args, 1, "use requires <database>");
                engine.useDatabase(args.get(0));
                currentDatabase.write(args.get(0));
                out.printf("Switched to database '%s'%n", args.get(0));
            }
            case "dbs" -> {
                List<String> dbs = engine.listDatabases();
                if (dbs.isEmpty()) {
                    out.println("No databases found");
                } else {
                    out.println("Available databases:");
                    String active = engine.currentDatabase();
                    for (String db : dbs) {
                        out.println((db.equals(active) ? "* " : "  ") + db);
                    }
                }
            }
            case "wipe", "drop" -> {
                engine.wipeDatabase();
                out.println("Database wiped successfully");
            }
            default -> throw new CliException("unknown command: " + words.get(0));
        }
    }

    private void schema(List<String> args) {
        if (args.isEmpty()) {
            List<String> schemas = engine.listSchemas();
            if (schemas.isEmpty()) {
                out.println("No schemas defined");
            } else {
                out.println("Defined schemas:");
                for (String schema : schemas) {
                    out.println("  " + schema);
                }
            }
        } else if (args.size() == 1) {
            String name = args.get(0);
            out.printf("Schema '%s': %s%n", name, engine.getSchema(name));
        } else {
            String name = args.get(0);
            engine.createSchema(name, String.join(" ", args.subList(1, args.size())));
            out.printf("Schema '%s' created successfully%n", name);
        }
    }

    private static void require(List<String> args, int count, String message) {
        if (args.size() < count) {
            throw new CliException(message);
        }
    }

    private static void configureLogging(boolean verbose) {
        Level level = verbose ? Level.FINE : Level.WARNING;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }
}
