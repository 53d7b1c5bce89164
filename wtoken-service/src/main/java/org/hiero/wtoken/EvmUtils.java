// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.apache.tuweni.bytes.Bytes;
import org.apache.tuweni.bytes.Bytes32;
import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Helpers for the EVM-flavoured value types used across the wrapped token: 20-byte addresses
 * and keccak-256 digests.
 */
public final class EvmUtils {
    public static final int EVM_ADDRESS_SIZE = 20;

    /** The zero address; the source of every mint and the destination of every burn. */
    public static final Address ZERO_ADDRESS = Address.wrap("0x0000000000000000000000000000000000000000");

    private EvmUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Returns the keccak-256 digest of the given bytes.
     *
     * @param data the bytes to hash
     * @return the 32-byte digest
     */
    public static Bytes32 keccak256(@NonNull final byte[] data) {
        requireNonNull(data);
        return Bytes32.wrap(new Keccak.Digest256().digest(data));
    }

    public static Bytes32 keccak256(@NonNull final Bytes data) {
        return keccak256(requireNonNull(data).toArrayUnsafe());
    }

    public static Bytes32 keccak256(@NonNull final String utf8) {
        return keccak256(requireNonNull(utf8).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Wraps 20 raw bytes as an address.
     *
     * @param evmAddress the raw address bytes
     * @return the address
     * @throws IllegalArgumentException if the input is not exactly 20 bytes
     */
    public static Address asAddress(@NonNull final byte[] evmAddress) {
        requireNonNull(evmAddress);
        if (evmAddress.length != EVM_ADDRESS_SIZE) {
            throw new IllegalArgumentException("EVM address must be 20 bytes, got " + evmAddress.length);
        }
        return asAddress(Bytes.wrap(evmAddress).toUnprefixedHexString());
    }

    /**
     * Parses an address from hex, with or without the {@code 0x} prefix and in any letter case.
     *
     * @param hex the hex form of the address
     * @return the address
     */
    public static Address asAddress(@NonNull final String hex) {
        requireNonNull(hex);
        final var unprefixed = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return Address.wrap(Address.toChecksumAddress("0x" + unprefixed.toLowerCase(Locale.ROOT)));
    }

    public static boolean isZero(@NonNull final Address address) {
        return requireNonNull(address).value().signum() == 0;
    }

    /**
     * Returns the lower-case, {@code 0x}-prefixed hex form of the address.
     */
    public static String toLowerHex(@NonNull final Address address) {
        return requireNonNull(address).toString().toLowerCase(Locale.ROOT);
    }
}
