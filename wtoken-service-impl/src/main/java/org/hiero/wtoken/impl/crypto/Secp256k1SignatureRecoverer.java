// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.crypto;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import java.util.Optional;
import org.apache.tuweni.bytes.Bytes32;
import org.hiero.wtoken.PermitSignature;
import org.hiero.wtoken.SignatureRecoverer;

/**
 * Recovers the signer of a digest the way the EVM {@code ecrecover} precompile does, additionally
 * rejecting malleable signatures: {@code v} must be 27 or 28, {@code r} and {@code s} must be in
 * {@code [1, n)}, and {@code s} must be in the lower half of the curve order.
 */
public class Secp256k1SignatureRecoverer implements SignatureRecoverer {
    private static final int V_BASE = 27;

    @NonNull
    @Override
    public Optional<Address> recoverSigner(@NonNull final Bytes32 digest, @NonNull final PermitSignature signature) {
        requireNonNull(digest);
        requireNonNull(signature);
        final int v = signature.v();
        if (v != V_BASE && v != V_BASE + 1) {
            return Optional.empty();
        }
        final var r = signature.r().toUnsignedBigInteger();
        final var s = signature.s().toUnsignedBigInteger();
        if (!inRange(r) || !inRange(s) || s.compareTo(Secp256k1.HALF_CURVE_ORDER) > 0) {
            return Optional.empty();
        }
        final var publicKey = Secp256k1.recoverPublicKey(v - V_BASE, r, s, digest.toArrayUnsafe());
        return Optional.ofNullable(publicKey).map(Secp256k1::addressOf);
    }

    private static boolean inRange(@NonNull final BigInteger component) {
        return component.signum() > 0 && component.compareTo(Secp256k1.CURVE.getN()) < 0;
    }
}
