// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;

/**
 * The fields of the EIP-712 signing domain permits are bound to. Anyone holding these four values
 * can recompute the domain separator.
 */
public record Eip712Domain(
        @NonNull String name,
        @NonNull String version,
        @NonNull BigInteger chainId,
        @NonNull Address verifyingContract) {
    public static final String PERMIT_VERSION = "1";

    public Eip712Domain {
        requireNonNull(name);
        requireNonNull(version);
        requireNonNull(chainId);
        requireNonNull(verifyingContract);
    }
}
