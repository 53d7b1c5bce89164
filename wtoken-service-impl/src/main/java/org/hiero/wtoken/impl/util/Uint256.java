// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.util;

import static java.util.Objects.requireNonNull;
import static org.hiero.wtoken.ResponseCode.ARITHMETIC_OVERFLOW;
import static org.hiero.wtoken.ResponseCode.INVALID_AMOUNT;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import org.hiero.wtoken.WrappedTokenException;

/**
 * Checked unsigned 256-bit arithmetic over {@link BigInteger}. Results never wrap or saturate; a
 * result outside {@code [0, 2^256 - 1]} fails with {@code ARITHMETIC_OVERFLOW}.
 */
public final class Uint256 {
    public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Uint256() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean isValid(@NonNull final BigInteger value) {
        return value.signum() >= 0 && value.bitLength() <= 256;
    }

    /**
     * Validates a caller supplied amount.
     *
     * @param value the amount
     * @return the same amount
     * @throws WrappedTokenException with {@code INVALID_AMOUNT} if the amount is not a uint256
     */
    public static BigInteger requireUint256(@NonNull final BigInteger value) {
        requireNonNull(value);
        if (!isValid(value)) {
            throw new WrappedTokenException(INVALID_AMOUNT, "Not a uint256 - " + value);
        }
        return value;
    }

    public static BigInteger add(@NonNull final BigInteger a, @NonNull final BigInteger b) {
        return checked(a.add(b));
    }

    public static BigInteger sub(@NonNull final BigInteger a, @NonNull final BigInteger b) {
        return checked(a.subtract(b));
    }

    /**
     * Computes {@code x * y / denominator} at full precision with the given rounding. Only the final
     * quotient has to fit in 256 bits.
     *
     * @throws WrappedTokenException with {@code ARITHMETIC_OVERFLOW} on a zero denominator or an
     *     oversized result
     */
    public static BigInteger mulDiv(
            @NonNull final BigInteger x,
            @NonNull final BigInteger y,
            @NonNull final BigInteger denominator,
            @NonNull final Rounding rounding) {
        requireNonNull(rounding);
        if (denominator.signum() == 0) {
            throw new WrappedTokenException(ARITHMETIC_OVERFLOW, "Division by zero");
        }
        final var qr = x.multiply(y).divideAndRemainder(denominator);
        var result = qr[0];
        if (rounding == Rounding.CEIL && qr[1].signum() != 0) {
            result = result.add(BigInteger.ONE);
        }
        return checked(result);
    }

    private static BigInteger checked(@NonNull final BigInteger result) {
        if (!isValid(result)) {
            throw new WrappedTokenException(ARITHMETIC_OVERFLOW, "Arithmetic overflow or underflow");
        }
        return result;
    }
}
