// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl;

import static org.hiero.wtoken.ResponseCode.REENTRANT_CALL;

import org.hiero.wtoken.WrappedTokenException;

/**
 * Rejects an operation that starts while another one on the same token is still running. This
 * catches a wrapped asset calling back into the token from inside one of its transfers; the
 * monitor alone cannot, since it is reentrant for the owning thread.
 */
class ReentrancyGuard {
    private boolean entered;

    void enter() {
        if (entered) {
            throw new WrappedTokenException(REENTRANT_CALL, "Reentrant call into the wrapped token");
        }
        entered = true;
    }

    void exit() {
        entered = false;
    }
}
