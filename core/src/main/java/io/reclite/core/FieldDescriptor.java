package io.reclite.core;

import java.util.Objects;

/**
 * One {@code name:type} entry of a schema definition.
 *
 * @param name         record field name
 * @param type         resolved type
 * @param declaredType type as written in the definition, kept for messages
 */
public record FieldDescriptor(String name, FieldType type, String declaredType) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(declaredType, "declaredType");
        if (name.isEmpty()) throw new IllegalArgumentException("name must not be empty");
    }
}
