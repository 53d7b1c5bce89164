// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;

/**
 * Assets entered the vault and shares were credited to {@code receiver}.
 */
public record Deposit(
        @NonNull Address caller,
        @NonNull Address receiver,
        @NonNull BigInteger assets,
        @NonNull BigInteger shares) implements WrappedTokenEvent {
    public Deposit {
        requireNonNull(caller);
        requireNonNull(receiver);
        requireNonNull(assets);
        requireNonNull(shares);
    }
}
