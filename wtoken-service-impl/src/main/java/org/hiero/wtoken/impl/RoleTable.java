// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl;

import static java.util.Objects.requireNonNull;
import static org.hiero.wtoken.ResponseCode.CAN_ONLY_RENOUNCE_FOR_SELF;
import static org.hiero.wtoken.WrappedTokenException.validateTrue;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.wtoken.AccessController;
import org.hiero.wtoken.Role;

/**
 * In-memory {@link AccessController}. Every role is administered by {@link Role#DEFAULT_ADMIN}.
 */
public class RoleTable implements AccessController {
    private static final Logger logger = LogManager.getLogger(RoleTable.class);

    private final Map<Role, Set<Address>> members = new EnumMap<>(Role.class);

    @Override
    public boolean hasRole(@NonNull final Role role, @NonNull final Address account) {
        requireNonNull(role);
        requireNonNull(account);
        return members.getOrDefault(role, Set.of()).contains(account);
    }

    @NonNull
    @Override
    public Role getRoleAdmin(@NonNull final Role role) {
        requireNonNull(role);
        return Role.DEFAULT_ADMIN;
    }

    @Override
    public void bootstrapAdmin(@NonNull final Address admin) {
        requireNonNull(admin);
        members.computeIfAbsent(Role.DEFAULT_ADMIN, r -> new HashSet<>()).add(admin);
        logger.info("Granted {} to initial admin {}", Role.DEFAULT_ADMIN.roleName(), admin);
    }

    @Override
    public boolean grantRole(@NonNull final Address caller, @NonNull final Role role, @NonNull final Address account) {
        requireRole(getRoleAdmin(role), caller);
        final var granted = members.computeIfAbsent(role, r -> new HashSet<>()).add(requireNonNull(account));
        if (granted) {
            logger.info("{} granted {} to {}", caller, role.roleName(), account);
        }
        return granted;
    }

    @Override
    public boolean revokeRole(@NonNull final Address caller, @NonNull final Role role, @NonNull final Address account) {
        requireRole(getRoleAdmin(role), caller);
        return remove(role, account);
    }

    @Override
    public boolean renounceRole(
            @NonNull final Address caller, @NonNull final Role role, @NonNull final Address account) {
        requireNonNull(caller);
        validateTrue(caller.equals(account), CAN_ONLY_RENOUNCE_FOR_SELF);
        return remove(role, account);
    }

    private boolean remove(@NonNull final Role role, @NonNull final Address account) {
        requireNonNull(role);
        requireNonNull(account);
        final var holders = members.get(role);
        final var removed = holders != null && holders.remove(account);
        if (removed) {
            logger.info("Revoked {} from {}", role.roleName(), account);
        }
        return removed;
    }
}
