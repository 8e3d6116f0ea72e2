// file: client/src/main/java/io/reclite/client/CliOptions.java
package io.reclite.client;

import io.reclite.core.SchemaPolicy;
import io.reclite.storage.StoreConfig;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Global options that precede the command word.
 * <p>
 * Supported flags:
 *   --root, -r <dir>     storage root holding one directory per database (default: ./dbs)
 *   --strict-schemas     reject malformed schema tokens and unknown types
 *   --verbose, -v        log engine activity to stderr
 *   --help, -h           print usage
 * <p>
 * Parsing stops at the first word that is not a flag, so record JSON and keys
 * starting with '-' are passed through untouched.
 */
public record CliOptions(Path root, boolean strictSchemas, boolean verbose, boolean help, List<String> command) {

    public CliOptions {
        command = List.copyOf(command);
    }

    public static CliOptions parse(String[] args) {
        Path root = StoreConfig.DEFAULT_ROOT;
        boolean strict = false;
        boolean verbose = false;
        boolean help = false;

        int i = 0;
        loop:
        for (; i < args.length; i++) {
            switch (args[i]) {
                case "--root", "-r" -> {
                    if (i + 1 >= args.length) {
                        throw new CliException("missing value for option: " + args[i]);
                    }
                    root = Path.of(args[++i]);
                }
                case "--strict-schemas" -> strict = true;
                case "--verbose", "-v" -> verbose = true;
                case "--help", "-h" -> help = true;
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new CliException("unknown option: " + args[i]);
                    }
                    break loop;
                }
            }
        }
        return new CliOptions(root, strict, verbose, help, Arrays.asList(args).subList(i, args.length));
    }

    /** Engine configuration for these options, starting on {@code database}. */
    public StoreConfig storeConfig(String database) {
        return StoreConfig.defaults()
                .withRoot(root)
                .withDefaultDatabase(database)
                .withSchemaPolicy(strictSchemas ? SchemaPolicy.STRICT : SchemaPolicy.PERMISSIVE);
    }
}
