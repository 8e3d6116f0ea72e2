package io.reclite.core;

import java.util.List;
import java.util.Objects;

/**
 * Parsed schema: the original definition string plus its ordered field descriptors.
 * <p>
 * The definition string is what gets persisted and shown back to users; the
 * descriptors are derived from it by {@link SchemaValidator#define}.
 */
public record SchemaDefinition(String name, String definition, List<FieldDescriptor> fields) {

    public SchemaDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");
        fields = List.copyOf(fields);
    }
}
