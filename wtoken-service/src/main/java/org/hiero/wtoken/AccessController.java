// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Role-based authorization consumed by the wrapped token. The wrapped token depends only on this
 * capability and never on how roles are stored.
 */
public interface AccessController {

    boolean hasRole(@NonNull Role role, @NonNull Address account);

    /**
     * Fails unless the account holds the role.
     *
     * @throws UnauthorizedException if the account is missing the role
     */
    default void requireRole(@NonNull final Role role, @NonNull final Address account) {
        if (!hasRole(role, account)) {
            throw new UnauthorizedException(account, role);
        }
    }

    /**
     * @return the role whose holders may grant and revoke the given role
     */
    @NonNull
    Role getRoleAdmin(@NonNull Role role);

    /**
     * Grants {@link Role#DEFAULT_ADMIN} to the given account without any caller check. Called exactly
     * once, by the initializer.
     */
    void bootstrapAdmin(@NonNull Address admin);

    /**
     * Grants a role; the caller must hold the role's admin role.
     *
     * @return whether the account did not hold the role before
     * @throws UnauthorizedException if the caller lacks the admin role
     */
    boolean grantRole(@NonNull Address caller, @NonNull Role role, @NonNull Address account);

    /**
     * Revokes a role; the caller must hold the role's admin role.
     *
     * @return whether the account held the role before
     * @throws UnauthorizedException if the caller lacks the admin role
     */
    boolean revokeRole(@NonNull Address caller, @NonNull Role role, @NonNull Address account);

    /**
     * Drops a role held by the caller itself.
     *
     * @throws WrappedTokenException with {@link ResponseCode#CAN_ONLY_RENOUNCE_FOR_SELF} if
     *     {@code account} is not the caller
     * @return whether the caller held the role before
     */
    boolean renounceRole(@NonNull Address caller, @NonNull Role role, @NonNull Address account);
}
