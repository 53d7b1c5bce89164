// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.state;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A single value whose writes are buffered until {@link #commit()}.
 *
 * @param <T> the value type
 */
public class WritableSingletonState<T> {
    private T committed;
    private T pending;

    public WritableSingletonState(@NonNull final T initialValue) {
        this.committed = requireNonNull(initialValue);
    }

    @NonNull
    public T get() {
        return pending != null ? pending : committed;
    }

    public void put(@NonNull final T value) {
        pending = requireNonNull(value);
    }

    public void commit() {
        if (pending != null) {
            committed = pending;
            pending = null;
        }
    }

    public void reset() {
        pending = null;
    }
}
