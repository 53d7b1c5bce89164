// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.crypto;

import static java.util.Objects.requireNonNull;
import static org.hiero.wtoken.EvmUtils.keccak256;

import com.esaulpaugh.headlong.abi.Address;
import com.esaulpaugh.headlong.abi.Tuple;
import com.esaulpaugh.headlong.abi.TupleType;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import org.apache.tuweni.bytes.Bytes;
import org.apache.tuweni.bytes.Bytes32;
import org.hiero.wtoken.Eip712Domain;

/**
 * EIP-712 hashing for permits. The domain separator depends on exactly the four fields of the
 * {@link Eip712Domain}, so it can be recomputed by anyone off-process.
 */
public final class TypedDataHasher {
    public static final Bytes32 DOMAIN_TYPEHASH =
            keccak256("EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)");
    public static final Bytes32 PERMIT_TYPEHASH =
            keccak256("Permit(address owner,address spender,uint256 value,uint256 nonce,uint256 deadline)");

    private static final TupleType<Tuple> DOMAIN_TUPLE = TupleType.parse("(bytes32,bytes32,bytes32,uint256,address)");
    private static final TupleType<Tuple> PERMIT_TUPLE =
            TupleType.parse("(bytes32,address,address,uint256,uint256,uint256)");
    private static final Bytes TYPED_DATA_PREFIX = Bytes.fromHexString("0x1901");

    private final Eip712Domain domain;
    private final Bytes32 domainSeparator;

    public TypedDataHasher(@NonNull final Eip712Domain domain) {
        this.domain = requireNonNull(domain);
        this.domainSeparator = domainSeparatorOf(domain);
    }

    /**
     * Computes {@code keccak256(abi.encode(DOMAIN_TYPEHASH, keccak256(name), keccak256(version),
     * chainId, verifyingContract))}.
     */
    public static Bytes32 domainSeparatorOf(@NonNull final Eip712Domain domain) {
        requireNonNull(domain);
        final var encoded = DOMAIN_TUPLE.encode(Tuple.of(
                DOMAIN_TYPEHASH.toArray(),
                keccak256(domain.name()).toArray(),
                keccak256(domain.version()).toArray(),
                domain.chainId(),
                domain.verifyingContract()));
        return keccak256(encoded.array());
    }

    public Eip712Domain domain() {
        return domain;
    }

    public Bytes32 domainSeparator() {
        return domainSeparator;
    }

    /**
     * Computes the struct hash of a permit message.
     */
    public Bytes32 permitStructHash(
            @NonNull final Address owner,
            @NonNull final Address spender,
            @NonNull final BigInteger value,
            @NonNull final BigInteger nonce,
            @NonNull final BigInteger deadline) {
        final var encoded = PERMIT_TUPLE.encode(Tuple.of(
                PERMIT_TYPEHASH.toArray(),
                requireNonNull(owner),
                requireNonNull(spender),
                requireNonNull(value),
                requireNonNull(nonce),
                requireNonNull(deadline)));
        return keccak256(encoded.array());
    }

    /**
     * Computes {@code keccak256(0x19 0x01 || domainSeparator || structHash)}, the digest that is
     * actually signed.
     */
    public Bytes32 hashTypedData(@NonNull final Bytes32 structHash) {
        return keccak256(Bytes.concatenate(TYPED_DATA_PREFIX, domainSeparator, requireNonNull(structHash)));
    }

    public Bytes32 permitDigest(
            @NonNull final Address owner,
            @NonNull final Address spender,
            @NonNull final BigInteger value,
            @NonNull final BigInteger nonce,
            @NonNull final BigInteger deadline) {
        return hashTypedData(permitStructHash(owner, spender, value, nonce, deadline));
    }
}
