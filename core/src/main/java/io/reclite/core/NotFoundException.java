package io.reclite.core;

public final class NotFoundException extends StoreException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException schema(String schema) {
        return new NotFoundException("schema '%s' does not exist".formatted(schema));
    }

    public static NotFoundException record(String schema, String key) {
        return new NotFoundException(
                "record with key '%s' does not exist in schema '%s'".formatted(key, schema));
    }
}
