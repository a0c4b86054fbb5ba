package io.cutpool.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Content-hash to candidates index.
 * <p>
 * Maps the {@code hashKey()} of stored objects to the values (slots, objects)
 * that were registered under it. A bucket only narrows the search for an
 * equal object; the index never owns what it points to, and its owner must
 * remove entries before the referenced value goes away.
 * <p>
 * Not thread-safe.
 *
 * @param <V> the indexed value type
 */
public final class ContentHashIndex<V> {
    private final Map<Long, List<V>> index;
    private int entries;

    public ContentHashIndex() {
        this(16);
    }

    public ContentHashIndex(int expectedSize) {
        if (expectedSize < 0) {
            throw new IllegalArgumentException("expectedSize must be non-negative: " + expectedSize);
        }
        this.index = new HashMap<>(Math.max(16, expectedSize));
    }

    public void add(long key, V value) {
        Objects.requireNonNull(value, "value");
        index.computeIfAbsent(key, ignored -> new ArrayList<>(1)).add(value);
        entries++;
    }

    /**
     * Remove one registration of {@code value} under {@code key}.
     *
     * @return true if the value was registered under the key
     */
    public boolean remove(long key, V value) {
        if (value == null) {
            return false;
        }
        List<V> bucket = index.get(key);
        if (bucket == null) {
            return false;
        }
        for (int i = 0; i < bucket.size(); i++) {
            if (bucket.get(i) == value) {
                bucket.remove(i);
                entries--;
                if (bucket.isEmpty()) {
                    index.remove(key);
                }
                return true;
            }
        }
        return false;
    }

    /**
     * Remove all values registered under the key.
     */
    public void removeAll(long key) {
        List<V> removed = index.remove(key);
        if (removed != null) {
            entries -= removed.size();
        }
    }

    /**
     * Values registered under the key, in registration order.
     */
    public List<V> lookup(long key) {
        List<V> bucket = index.get(key);
        return bucket == null ? Collections.emptyList() : Collections.unmodifiableList(bucket);
    }

    /**
     * First value under the key accepted by {@code matcher}, or null.
     */
    public V find(long key, Predicate<? super V> matcher) {
        List<V> bucket = index.get(key);
        if (bucket == null) {
            return null;
        }
        for (V candidate : bucket) {
            if (matcher.test(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Clear all entries from the index.
     */
    public void clear() {
        index.clear();
        entries = 0;
    }

    /**
     * Number of registered values.
     */
    public int size() {
        return entries;
    }

    /**
     * Number of distinct keys.
     */
    public int keyCount() {
        return index.size();
    }

    /**
     * Number of values sharing their key with an earlier value.
     * A high number hints at a weak {@code hashKey()}.
     */
    public int collisions() {
        return entries - index.size();
    }
}
