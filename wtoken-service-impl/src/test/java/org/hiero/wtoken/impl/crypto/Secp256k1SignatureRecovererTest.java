// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import org.apache.tuweni.bytes.Bytes;
import org.apache.tuweni.bytes.Bytes32;
import org.hiero.wtoken.EvmUtils;
import org.hiero.wtoken.PermitSignature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class Secp256k1SignatureRecovererTest {
    private static final BigInteger OWNER_KEY =
            new BigInteger("ac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80", 16);
    private static final BigInteger OTHER_KEY =
            new BigInteger("59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d", 16);
    private static final Bytes32 DIGEST = EvmUtils.keccak256("a permit digest");

    private final Secp256k1SignatureRecoverer subject = new Secp256k1SignatureRecoverer();
    private final PermitSigner owner = new PermitSigner(OWNER_KEY);

    @Test
    void signersDeriveTheirEvmAddress() {
        assertThat(owner.address()).isEqualTo(EvmUtils.asAddress("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266"));
        assertThat(new PermitSigner(OTHER_KEY).address())
                .isEqualTo(EvmUtils.asAddress("0x70997970c51812dc3a010c7d01b50e0d17dc79c8"));
        assertThat(new PermitSigner(BigInteger.ONE).address())
                .isEqualTo(EvmUtils.asAddress("0x7e5f4552091a69125d5dfcb7b8c2659029395bdf"));
    }

    @Test
    void recoversTheSigner() {
        final var signature = owner.signDigest(DIGEST);

        assertThat(signature.v()).isIn(27, 28);
        assertThat(signature.s().toUnsignedBigInteger()).isLessThanOrEqualTo(Secp256k1.HALF_CURVE_ORDER);
        assertThat(subject.recoverSigner(DIGEST, signature)).contains(owner.address());
    }

    @Test
    void signingIsDeterministic() {
        assertThat(owner.signDigest(DIGEST)).isEqualTo(owner.signDigest(DIGEST));
    }

    @Test
    void aDifferentDigestRecoversSomeoneElse() {
        final var signature = owner.signDigest(DIGEST);
        final var recovered = subject.recoverSigner(EvmUtils.keccak256("another digest"), signature);

        assertThat(recovered).doesNotContain(owner.address());
    }

    @Test
    void joinedFormRoundTrips() {
        final var signature = owner.signDigest(DIGEST);
        final var joined = signature.toBytes();

        assertThat(joined.size()).isEqualTo(PermitSignature.SIGNATURE_LENGTH);
        assertThat(subject.recoverSigner(DIGEST, PermitSignature.fromBytes(joined)))
                .contains(owner.address());
    }

    @Nested
    @DisplayName("Malformed signatures")
    class Malformed {

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 26, 29, 255})
        void rejectsRecoveryBytesOtherThan27Or28(final int v) {
            final var signature = owner.signDigest(DIGEST);
            final var tampered = new PermitSignature(v, signature.r(), signature.s());

            assertThat(subject.recoverSigner(DIGEST, tampered)).isEmpty();
        }

        @Test
        void rejectsHighS() {
            final var signature = owner.signDigest(DIGEST);
            final var highS = Secp256k1.CURVE.getN().subtract(signature.s().toUnsignedBigInteger());
            final var flippedV = signature.v() == 27 ? 28 : 27;
            final var malleable = new PermitSignature(flippedV, signature.r(), toBytes32(highS));

            assertThat(subject.recoverSigner(DIGEST, malleable)).isEmpty();
        }

        @Test
        void rejectsZeroAndOutOfRangeComponents() {
            final var signature = owner.signDigest(DIGEST);
            final var curveOrder = toBytes32(Secp256k1.CURVE.getN());

            assertThat(subject.recoverSigner(DIGEST, new PermitSignature(27, Bytes32.ZERO, signature.s())))
                    .isEmpty();
            assertThat(subject.recoverSigner(DIGEST, new PermitSignature(27, signature.r(), Bytes32.ZERO)))
                    .isEmpty();
            assertThat(subject.recoverSigner(DIGEST, new PermitSignature(27, curveOrder, signature.s())))
                    .isEmpty();
        }

        @Test
        void joinedFormMustBe65Bytes() {
            assertThatThrownBy(() -> PermitSignature.fromBytes(Bytes.wrap(new byte[64])))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static Bytes32 toBytes32(final BigInteger value) {
        return Bytes32.leftPad(Bytes.wrap(value.toByteArray()).trimLeadingZeros());
    }
}
