// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;

/**
 * The allowance of {@code spender} over the shares of {@code owner} was set to {@code value}.
 */
public record Approval(
        @NonNull Address owner,
        @NonNull Address spender,
        @NonNull BigInteger value) implements WrappedTokenEvent {
    public Approval {
        requireNonNull(owner);
        requireNonNull(spender);
        requireNonNull(value);
    }
}
