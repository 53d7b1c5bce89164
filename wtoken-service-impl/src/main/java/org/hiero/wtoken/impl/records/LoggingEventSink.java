// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.records;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.wtoken.records.WrappedTokenEvent;
import org.hiero.wtoken.records.WrappedTokenEventSink;

/**
 * Writes each record to the log at DEBUG, then hands it to the delegate sink.
 */
public class LoggingEventSink implements WrappedTokenEventSink {
    private static final Logger logger = LogManager.getLogger(LoggingEventSink.class);

    private final WrappedTokenEventSink delegate;

    public LoggingEventSink(@NonNull final WrappedTokenEventSink delegate) {
        this.delegate = requireNonNull(delegate);
    }

    @Override
    public void onEvent(@NonNull final WrappedTokenEvent event) {
        logger.debug("{} {}", event.eventName(), event);
        delegate.onEvent(event);
    }
}
