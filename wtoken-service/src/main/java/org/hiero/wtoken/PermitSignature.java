// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.apache.tuweni.bytes.Bytes;
import org.apache.tuweni.bytes.Bytes32;

/**
 * The split form of a secp256k1 signature over a permit.
 *
 * @param v the recovery byte, 27 or 28 for a well-formed signature
 * @param r the r component
 * @param s the s component
 */
public record PermitSignature(int v, @NonNull Bytes32 r, @NonNull Bytes32 s) {
    public static final int SIGNATURE_LENGTH = 65;

    public PermitSignature {
        requireNonNull(r);
        requireNonNull(s);
    }

    /**
     * Splits a 65-byte {@code r || s || v} signature.
     *
     * @param signature the joined signature
     * @return the split signature
     */
    public static PermitSignature fromBytes(@NonNull final Bytes signature) {
        requireNonNull(signature);
        if (signature.size() != SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("Signature must be 65 bytes, got " + signature.size());
        }
        return new PermitSignature(
                signature.get(64) & 0xFF, Bytes32.wrap(signature.slice(0, 32)), Bytes32.wrap(signature.slice(32, 32)));
    }

    /**
     * @return the joined {@code r || s || v} form
     */
    public Bytes toBytes() {
        return Bytes.concatenate(r, s, Bytes.of((byte) v));
    }
}
