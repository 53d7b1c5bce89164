// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A share movement touched an account on the wrapped asset's ban list. The status is either
 * {@link ResponseCode#BLOCKED_SENDER} or {@link ResponseCode#BLOCKED_RECEIVER}.
 */
public class BlockedAccountException extends WrappedTokenException {
    private final Address account;

    public BlockedAccountException(@NonNull final ResponseCode status, @NonNull final Address account) {
        super(status, status + ": " + account);
        if (status != ResponseCode.BLOCKED_SENDER && status != ResponseCode.BLOCKED_RECEIVER) {
            throw new IllegalArgumentException("Not a ban status - " + status);
        }
        this.account = requireNonNull(account);
    }

    public Address account() {
        return account;
    }
}
