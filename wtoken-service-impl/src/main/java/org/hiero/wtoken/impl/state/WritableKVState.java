// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.state;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A key/value state whose writes are buffered until {@link #commit()}. Reads see the buffered writes
 * first, then the committed values. {@link #reset()} drops the buffer, which is how a failed
 * operation leaves no trace.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class WritableKVState<K, V> {
    /** Committed values */
    private final Map<K, V> dataSource = new HashMap<>();

    /** Values written since the last commit or reset */
    private final Map<K, V> modifications = new LinkedHashMap<>();

    @Nullable
    public V get(@NonNull final K key) {
        requireNonNull(key);
        // a buffered write wins over the committed value
        if (modifications.containsKey(key)) {
            return modifications.get(key);
        }
        return dataSource.get(key);
    }

    public V getOrDefault(@NonNull final K key, @NonNull final V defaultValue) {
        final var value = get(key);
        return value == null ? defaultValue : value;
    }

    public void put(@NonNull final K key, @NonNull final V value) {
        requireNonNull(key);
        requireNonNull(value);
        modifications.put(key, value);
    }

    /**
     * Flushes all buffered writes into the committed values.
     */
    public void commit() {
        dataSource.putAll(modifications);
        modifications.clear();
    }

    /**
     * Drops all buffered writes. Semantically a rollback.
     */
    public void reset() {
        modifications.clear();
    }
}
