// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The local pause flag was raised by {@code account}.
 */
public record Paused(@NonNull Address account) implements WrappedTokenEvent {
    public Paused {
        requireNonNull(account);
    }
}
