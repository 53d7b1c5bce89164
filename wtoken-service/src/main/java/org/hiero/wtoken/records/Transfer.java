// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;

/**
 * Shares moved between holders; a zero {@code from} is a mint and a zero {@code to} is a burn.
 */
public record Transfer(
        @NonNull Address from,
        @NonNull Address to,
        @NonNull BigInteger value) implements WrappedTokenEvent {
    public Transfer {
        requireNonNull(from);
        requireNonNull(to);
        requireNonNull(value);
    }
}
