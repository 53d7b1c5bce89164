// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

/**
 * A record emitted by a successful wrapped token operation. Records of an operation are only
 * published once the operation has fully applied.
 */
public interface WrappedTokenEvent {

    /**
     * @return the name of the record, as it appears in logs
     */
    default String eventName() {
        return getClass().getSimpleName();
    }
}
