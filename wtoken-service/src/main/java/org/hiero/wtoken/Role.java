// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.apache.tuweni.bytes.Bytes32;

/**
 * The roles recognized by the wrapped token. Each role has a 32-byte identifier: the admin role
 * is all zeros, every other role is the keccak-256 digest of its name.
 */
public enum Role {
    DEFAULT_ADMIN("DEFAULT_ADMIN_ROLE", Bytes32.ZERO),
    PAUSE("PAUSE_ROLE", EvmUtils.keccak256("PAUSE_ROLE")),
    UPGRADE("UPGRADE_ROLE", EvmUtils.keccak256("UPGRADE_ROLE"));

    private final String roleName;
    private final Bytes32 id;

    Role(@NonNull final String roleName, @NonNull final Bytes32 id) {
        this.roleName = roleName;
        this.id = id;
    }

    public String roleName() {
        return roleName;
    }

    public Bytes32 id() {
        return id;
    }
}
