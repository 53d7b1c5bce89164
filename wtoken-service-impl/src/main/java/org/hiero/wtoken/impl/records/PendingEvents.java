// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.records;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.wtoken.records.WrappedTokenEvent;
import org.hiero.wtoken.records.WrappedTokenEventSink;

/**
 * Holds the records an operation emits until the operation commits. A failed operation clears
 * them, so sinks never observe records of work that was rolled back.
 */
public class PendingEvents {
    private static final Logger logger = LogManager.getLogger(PendingEvents.class);

    private final List<WrappedTokenEvent> pending = new ArrayList<>();

    public void emit(@NonNull final WrappedTokenEvent event) {
        pending.add(requireNonNull(event));
    }

    /**
     * Publishes the held records to the sink in emission order and forgets them. Called only after
     * the operation committed, so a record the sink rejects is logged and the rest still go out.
     */
    public void flushTo(@NonNull final WrappedTokenEventSink sink) {
        requireNonNull(sink);
        final var toPublish = List.copyOf(pending);
        pending.clear();
        for (final var event : toPublish) {
            try {
                sink.onEvent(event);
            } catch (RuntimeException e) {
                logger.error("Event sink rejected committed record {}", event, e);
            }
        }
    }

    public void clear() {
        pending.clear();
    }

    public List<WrappedTokenEvent> pending() {
        return List.copyOf(pending);
    }
}
