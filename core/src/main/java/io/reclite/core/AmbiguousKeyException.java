package io.reclite.core;

import java.util.List;

/**
 * A partial key matched more than one record. The candidates are kept so the
 * caller can show them and retry with a longer key.
 */
public final class AmbiguousKeyException extends StoreException {
    private final String partialKey;
    private final List<String> candidates;

    public AmbiguousKeyException(String schema, String partialKey, List<String> candidates) {
        super(ErrorKind.AMBIGUOUS_KEY,
                "multiple records match partial key '%s' in schema '%s': %s"
                        .formatted(partialKey, schema, candidates));
        this.partialKey = partialKey;
        this.candidates = List.copyOf(candidates);
    }

    public String partialKey() {
        return partialKey;
    }

    public List<String> candidates() {
        return candidates;
    }
}
