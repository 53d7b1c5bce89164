// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.state;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Identifies the allowance {@code owner} has given {@code spender}.
 */
public record AllowanceKey(@NonNull Address owner, @NonNull Address spender) {
    public AllowanceKey {
        requireNonNull(owner);
        requireNonNull(spender);
    }
}
