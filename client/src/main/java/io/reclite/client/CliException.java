package io.reclite.client;

/** Command-line usage error: wrong arguments, unknown command or option. */
final class CliException extends RuntimeException {
    CliException(String msg) {
        super(msg);
    }
}
