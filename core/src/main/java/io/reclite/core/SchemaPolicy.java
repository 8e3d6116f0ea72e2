package io.reclite.core;

/**
 * How forgiving schema parsing is.
 *
 * @param skipMalformedTokens drop tokens that are not {@code name:type} instead of failing
 * @param acceptUnknownTypes  keep unrecognised type names as {@link FieldType#UNKNOWN}
 *                            (which accepts any value) instead of failing
 */
public record SchemaPolicy(boolean skipMalformedTokens, boolean acceptUnknownTypes) {

    /** Default: malformed tokens are skipped and unknown types accept anything. */
    public static final SchemaPolicy PERMISSIVE = new SchemaPolicy(true, true);

    public static final SchemaPolicy STRICT = new SchemaPolicy(false, false);
}
