// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Receives the records emitted by the wrapped token, in emission order.
 */
@FunctionalInterface
public interface WrappedTokenEventSink {

    /** A sink that drops every record. */
    WrappedTokenEventSink NO_OP = event -> {};

    void onEvent(@NonNull WrappedTokenEvent event);
}
