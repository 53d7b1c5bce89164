// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The calling account does not hold the role an operation requires.
 */
public class UnauthorizedException extends WrappedTokenException {
    private final Address account;
    private final Role role;

    public UnauthorizedException(@NonNull final Address account, @NonNull final Role role) {
        super(
                ResponseCode.UNAUTHORIZED,
                "AccessControl: account " + EvmUtils.toLowerHex(account) + " is missing role "
                        + role.id().toHexString());
        this.account = requireNonNull(account);
        this.role = requireNonNull(role);
    }

    public Address account() {
        return account;
    }

    public Role role() {
        return role;
    }
}
