// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.crypto;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.math.BigInteger;
import java.util.Arrays;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.hiero.wtoken.EvmUtils;

/**
 * secp256k1 curve math: public key recovery from an ECDSA signature (SEC 1 v2, section 4.1.6) and
 * derivation of EVM addresses from public keys.
 */
public final class Secp256k1 {
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    public static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(), CURVE_PARAMS.getH());

    /** Half the curve order; signatures with a larger {@code s} are malleable and are rejected. */
    public static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private Secp256k1() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Recovers the public key that produced the signature {@code (r, s)} over {@code messageHash}.
     *
     * @param recId the recovery id, 0 to 3
     * @param r the r component, in {@code [1, n)}
     * @param s the s component, in {@code [1, n)}
     * @param messageHash the signed 32-byte digest
     * @return the public key, or null if no point is recoverable for these inputs
     */
    @Nullable
    public static ECPoint recoverPublicKey(
            final int recId,
            @NonNull final BigInteger r,
            @NonNull final BigInteger s,
            @NonNull final byte[] messageHash) {
        requireNonNull(r);
        requireNonNull(s);
        requireNonNull(messageHash);
        if (recId < 0 || recId > 3) {
            throw new IllegalArgumentException("Recovery id must be in [0, 3], got " + recId);
        }
        final var n = CURVE.getN();
        final var x = r.add(BigInteger.valueOf(recId / 2L).multiply(n));
        final var prime = CURVE.getCurve().getField().getCharacteristic();
        if (x.compareTo(prime) >= 0) {
            return null;
        }
        final ECPoint bigR;
        try {
            bigR = decompressKey(x, (recId & 1) == 1);
        } catch (IllegalArgumentException e) {
            // x is not the abscissa of a curve point
            return null;
        }
        if (!bigR.multiply(n).isInfinity()) {
            return null;
        }
        final var e = new BigInteger(1, messageHash);
        final var eInv = BigInteger.ZERO.subtract(e).mod(n);
        final var rInv = r.modInverse(n);
        final var srInv = rInv.multiply(s).mod(n);
        final var eInvrInv = rInv.multiply(eInv).mod(n);
        final var q = ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), eInvrInv, bigR, srInv);
        return q.isInfinity() ? null : q.normalize();
    }

    /**
     * @return the public key of the given private key
     */
    public static ECPoint publicKeyOf(@NonNull final BigInteger privateKey) {
        requireNonNull(privateKey);
        if (privateKey.signum() <= 0 || privateKey.compareTo(CURVE.getN()) >= 0) {
            throw new IllegalArgumentException("Private key out of range");
        }
        return new FixedPointCombMultiplier().multiply(CURVE.getG(), privateKey).normalize();
    }

    /**
     * Derives the EVM address of a public key: the last 20 bytes of the keccak-256 digest of the
     * uncompressed point without its prefix byte.
     */
    public static Address addressOf(@NonNull final ECPoint publicKey) {
        final var encoded = requireNonNull(publicKey).getEncoded(false);
        final var digest = EvmUtils.keccak256(Arrays.copyOfRange(encoded, 1, encoded.length))
                .toArrayUnsafe();
        return EvmUtils.asAddress(Arrays.copyOfRange(digest, 12, 32));
    }

    private static ECPoint decompressKey(@NonNull final BigInteger x, final boolean yBit) {
        final var converter = new X9IntegerConverter();
        final var compressed = converter.integerToBytes(x, 1 + converter.getByteLength(CURVE.getCurve()));
        compressed[0] = (byte) (yBit ? 0x03 : 0x02);
        return CURVE.getCurve().decodePoint(compressed);
    }
}
