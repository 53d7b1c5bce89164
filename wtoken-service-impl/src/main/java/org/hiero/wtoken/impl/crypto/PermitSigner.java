// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.crypto;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import java.util.Arrays;
import org.apache.tuweni.bytes.Bytes;
import org.apache.tuweni.bytes.Bytes32;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.hiero.wtoken.Eip712Domain;
import org.hiero.wtoken.PermitSignature;

/**
 * Client side signing of permits with a secp256k1 private key. Signatures are deterministic
 * (RFC 6979) and normalized to a low {@code s}.
 */
public class PermitSigner {
    private final BigInteger privateKey;
    private final byte[] encodedPublicKey;
    private final Address address;

    public PermitSigner(@NonNull final BigInteger privateKey) {
        this.privateKey = requireNonNull(privateKey);
        final var publicKey = Secp256k1.publicKeyOf(privateKey);
        this.encodedPublicKey = publicKey.getEncoded(false);
        this.address = Secp256k1.addressOf(publicKey);
    }

    /**
     * @return the address whose signatures this signer produces
     */
    public Address address() {
        return address;
    }

    /**
     * Signs a permit of this signer's shares for the given domain.
     */
    public PermitSignature signPermit(
            @NonNull final Eip712Domain domain,
            @NonNull final Address spender,
            @NonNull final BigInteger value,
            @NonNull final BigInteger nonce,
            @NonNull final BigInteger deadline) {
        final var digest = new TypedDataHasher(domain).permitDigest(address, spender, value, nonce, deadline);
        return signDigest(digest);
    }

    /**
     * Signs an arbitrary 32-byte digest.
     */
    public PermitSignature signDigest(@NonNull final Bytes32 digest) {
        requireNonNull(digest);
        final var signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(privateKey, Secp256k1.CURVE));
        final var components = signer.generateSignature(digest.toArrayUnsafe());
        final var r = components[0];
        var s = components[1];
        if (s.compareTo(Secp256k1.HALF_CURVE_ORDER) > 0) {
            s = Secp256k1.CURVE.getN().subtract(s);
        }
        final int recId = recoveryIdOf(r, s, digest.toArrayUnsafe());
        return new PermitSignature(27 + recId, toBytes32(r), toBytes32(s));
    }

    private int recoveryIdOf(@NonNull final BigInteger r, @NonNull final BigInteger s, @NonNull final byte[] digest) {
        for (int recId = 0; recId < 4; recId++) {
            final var candidate = Secp256k1.recoverPublicKey(recId, r, s, digest);
            if (candidate != null && Arrays.equals(candidate.getEncoded(false), encodedPublicKey)) {
                return recId;
            }
        }
        throw new IllegalStateException("No recovery id reproduces the signing key");
    }

    private static Bytes32 toBytes32(@NonNull final BigInteger value) {
        return Bytes32.leftPad(Bytes.wrap(value.toByteArray()).trimLeadingZeros());
    }
}
