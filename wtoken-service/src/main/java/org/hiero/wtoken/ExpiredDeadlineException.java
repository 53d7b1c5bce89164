// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;

/**
 * A permit was submitted after its deadline.
 */
public class ExpiredDeadlineException extends WrappedTokenException {
    private final BigInteger deadline;
    private final BigInteger now;

    /**
     * @param deadline the deadline carried by the permit, in epoch seconds
     * @param now the time the permit was evaluated at, in epoch seconds
     */
    public ExpiredDeadlineException(@NonNull final BigInteger deadline, @NonNull final BigInteger now) {
        super(ResponseCode.EXPIRED_DEADLINE, "Permit deadline " + deadline + " expired at " + now);
        this.deadline = requireNonNull(deadline);
        this.now = requireNonNull(now);
    }

    public BigInteger deadline() {
        return deadline;
    }

    public BigInteger now() {
        return now;
    }
}
