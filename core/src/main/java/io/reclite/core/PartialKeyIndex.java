// file: src/main/java/io/reclite/core/PartialKeyIndex.java
package io.reclite.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Secondary index from a fixed-length key prefix to the full keys sharing it.
 * <p>
 * Bucket granularity is {@link #PREFIX_LENGTH} code points: a key shorter than
 * that is its own bucket. Lookups for partials of at least that length hit a
 * single bucket; shorter partials fan out over every bucket that could hold a
 * match. Both paths filter by a literal {@code startsWith} so a shared bucket
 * never leaks a false positive.
 * <p>
 * Invariants (maintained by the owner):
 *  - every key of the indexed record map is in the bucket of its prefix,
 *  - every key in any bucket exists in the record map.
 * <p>
 * {@link #remove} leaves an emptied bucket in place. Equality only looks at
 * non-empty buckets, so an index maintained through inserts and removes equals
 * one rebuilt from the surviving keys.
 * <p>
 * Not thread-safe; the storage engine guards it with its own lock.
 */
public final class PartialKeyIndex {

    public static final int PREFIX_LENGTH = 5;

    private final Map<String, Set<String>> buckets = new TreeMap<>();

    public PartialKeyIndex() {
    }

    /** Build an index over {@code keys} in one pass. */
    public static PartialKeyIndex rebuild(Collection<String> keys) {
        PartialKeyIndex index = new PartialKeyIndex();
        for (String key : keys) {
            index.insert(key);
        }
        return index;
    }

    /** First {@link #PREFIX_LENGTH} code points of {@code key}, or the whole key if shorter. */
    public static String prefixOf(String key) {
        if (key.codePointCount(0, key.length()) <= PREFIX_LENGTH) {
            return key;
        }
        return key.substring(0, key.offsetByCodePoints(0, PREFIX_LENGTH));
    }

    /** Add a key. Adding a key twice is a no-op. */
    public void insert(String key) {
        Objects.requireNonNull(key, "key");
        buckets.computeIfAbsent(prefixOf(key), p -> new TreeSet<>()).add(key);
    }

    /** Remove a key; its bucket stays, possibly empty. */
    public void remove(String key) {
        Objects.requireNonNull(key, "key");
        Set<String> bucket = buckets.get(prefixOf(key));
        if (bucket != null) {
            bucket.remove(key);
        }
    }

    /**
     * Full keys starting with {@code partial}, sorted. An empty partial matches nothing.
     */
    public List<String> lookup(String partial) {
        Objects.requireNonNull(partial, "partial");
        if (partial.isEmpty()) {
            return List.of();
        }

        List<String> matches = new ArrayList<>();
        if (partial.codePointCount(0, partial.length()) >= PREFIX_LENGTH) {
            Set<String> bucket = buckets.get(prefixOf(partial));
            if (bucket != null) {
                collect(bucket, partial, matches);
            }
        } else {
            for (Map.Entry<String, Set<String>> e : buckets.entrySet()) {
                String prefix = e.getKey();
                if (prefix.startsWith(partial) || partial.startsWith(prefix)) {
                    collect(e.getValue(), partial, matches);
                }
            }
        }
        Collections.sort(matches);
        return matches;
    }

    private static void collect(Set<String> bucket, String partial, List<String> out) {
        for (String key : bucket) {
            if (key.startsWith(partial)) {
                out.add(key);
            }
        }
    }

    public boolean contains(String key) {
        Set<String> bucket = buckets.get(prefixOf(key));
        return bucket != null && bucket.contains(key);
    }

    /** Number of indexed keys. */
    public int size() {
        int n = 0;
        for (Set<String> bucket : buckets.values()) {
            n += bucket.size();
        }
        return n;
    }

    /** Read-only copy of the non-empty buckets, prefix -> keys. */
    public Map<String, Set<String>> buckets() {
        Map<String, Set<String>> copy = new TreeMap<>();
        for (Map.Entry<String, Set<String>> e : buckets.entrySet()) {
            if (!e.getValue().isEmpty()) {
                copy.put(e.getKey(), Collections.unmodifiableSet(new TreeSet<>(e.getValue())));
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    /** Number of buckets including emptied ones. */
    int rawBucketCount() {
        return buckets.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartialKeyIndex other)) return false;
        return buckets().equals(other.buckets());
    }

    @Override
    public int hashCode() {
        return buckets().hashCode();
    }

    @Override
    public String toString() {
        return "PartialKeyIndex" + buckets();
    }
}
