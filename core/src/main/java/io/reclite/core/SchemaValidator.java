// file: src/main/java/io/reclite/core/SchemaValidator.java
package io.reclite.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parses schema definition strings and checks records against them.
 * <p>
 * Definition grammar: whitespace-separated {@code field:type} tokens, e.g.
 * {@code "name:string age:int email:string"}. What happens to malformed tokens
 * and unrecognised type names is decided by the {@link SchemaPolicy}.
 * <p>
 * Validation rules:
 *  - only fields present in both the schema and the record are checked,
 *  - missing fields are fine (every field is optional),
 *  - extra record fields are fine,
 *  - the first mismatch (in schema order) is reported, nothing is aggregated.
 */
public final class SchemaValidator {

    private final SchemaPolicy policy;

    public SchemaValidator() {
        this(SchemaPolicy.PERMISSIVE);
    }

    public SchemaValidator(SchemaPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Parse a definition string.
     *
     * @throws InvalidInputException only under a strict policy, for a malformed
     *                               token or an unknown type name
     */
    public SchemaDefinition define(String name, String definition) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");

        Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        for (String token : definition.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            String[] pair = token.split(":", -1);
            if (pair.length != 2 || pair[0].isEmpty() || pair[1].isEmpty()) {
                if (policy.skipMalformedTokens()) {
                    continue;
                }
                throw new InvalidInputException(
                        "malformed schema token '%s' in schema '%s' (expected field:type)".formatted(token, name));
            }
            FieldType type = FieldType.fromName(pair[1]);
            if (type == FieldType.UNKNOWN && !policy.acceptUnknownTypes()) {
                throw new InvalidInputException(
                        "unknown type '%s' for field '%s' in schema '%s'".formatted(pair[1], pair[0], name));
            }
            fields.put(pair[0], new FieldDescriptor(pair[0], type, pair[1]));
        }
        return new SchemaDefinition(name, definition, new ArrayList<>(fields.values()));
    }

    /** Check a record, returning the first mismatch if any. */
    public Optional<ValidationError> validate(SchemaDefinition schema, RecordValue.ObjectValue record) {
        for (FieldDescriptor field : schema.fields()) {
            RecordValue value = record.get(field.name());
            if (value == null) {
                continue;
            }
            if (!field.type().accepts(value)) {
                return Optional.of(new ValidationError(field.name(), field.declaredType(), RecordJson.render(value)));
            }
        }
        return Optional.empty();
    }

    /** Same as {@link #validate} but throws on the first mismatch. */
    public void requireValid(SchemaDefinition schema, RecordValue.ObjectValue record) {
        Optional<ValidationError> error = validate(schema, record);
        if (error.isPresent()) {
            throw new ValidationFailedException(error.get());
        }
    }
}
