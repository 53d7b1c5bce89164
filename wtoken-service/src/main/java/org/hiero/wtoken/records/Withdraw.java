// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;

/**
 * Shares of {@code owner} were burned and assets left the vault to {@code receiver}.
 */
public record Withdraw(
        @NonNull Address caller,
        @NonNull Address receiver,
        @NonNull Address owner,
        @NonNull BigInteger assets,
        @NonNull BigInteger shares) implements WrappedTokenEvent {
    public Withdraw {
        requireNonNull(caller);
        requireNonNull(receiver);
        requireNonNull(owner);
        requireNonNull(assets);
        requireNonNull(shares);
    }
}
