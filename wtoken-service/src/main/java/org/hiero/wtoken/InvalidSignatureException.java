// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A permit signature was malformed or was not produced by the owner it names.
 */
public class InvalidSignatureException extends WrappedTokenException {
    private final Address owner;
    private final Address spender;

    public InvalidSignatureException(@NonNull final Address owner, @NonNull final Address spender) {
        super(
                ResponseCode.INVALID_SIGNATURE,
                "Invalid permit signature for owner " + owner + " and spender " + spender);
        this.owner = requireNonNull(owner);
        this.spender = requireNonNull(spender);
    }

    public Address owner() {
        return owner;
    }

    public Address spender() {
        return spender;
    }
}
