// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.wtoken.Role;

/**
 * {@code role} was revoked from {@code account} by {@code sender}.
 */
public record RoleRevoked(
        @NonNull Role role,
        @NonNull Address account,
        @NonNull Address sender) implements WrappedTokenEvent {
    public RoleRevoked {
        requireNonNull(role);
        requireNonNull(account);
        requireNonNull(sender);
    }
}
