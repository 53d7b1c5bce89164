// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.util;

import static java.math.BigInteger.ONE;
import static java.math.BigInteger.TWO;
import static java.math.BigInteger.ZERO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hiero.wtoken.ResponseCode.ARITHMETIC_OVERFLOW;
import static org.hiero.wtoken.ResponseCode.INVALID_AMOUNT;

import java.math.BigInteger;
import org.hiero.wtoken.WrappedTokenException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class Uint256Test {

    @Test
    void maxValueIsTwoToThe256MinusOne() {
        assertThat(Uint256.MAX_VALUE.bitLength()).isEqualTo(256);
        assertThat(Uint256.MAX_VALUE.add(ONE)).isEqualTo(ONE.shiftLeft(256));
    }

    @Test
    void rejectsNegativeAndOversizedAmounts() {
        assertThatThrownBy(() -> Uint256.requireUint256(BigInteger.valueOf(-1)))
                .isInstanceOf(WrappedTokenException.class)
                .extracting(e -> ((WrappedTokenException) e).getStatus())
                .isEqualTo(INVALID_AMOUNT);
        assertThatThrownBy(() -> Uint256.requireUint256(Uint256.MAX_VALUE.add(ONE)))
                .isInstanceOf(WrappedTokenException.class);
        assertThat(Uint256.requireUint256(Uint256.MAX_VALUE)).isEqualTo(Uint256.MAX_VALUE);
        assertThat(Uint256.requireUint256(ZERO)).isEqualTo(ZERO);
    }

    @Test
    @DisplayName("add and sub never wrap")
    void addAndSubAreChecked() {
        assertThat(Uint256.add(ONE, TWO)).isEqualTo(BigInteger.valueOf(3));
        assertThat(Uint256.sub(TWO, ONE)).isEqualTo(ONE);
        assertOverflow(() -> Uint256.add(Uint256.MAX_VALUE, ONE));
        assertOverflow(() -> Uint256.sub(ONE, TWO));
    }

    @ParameterizedTest
    @CsvSource({"7, 3, 2, FLOOR, 10", "7, 3, 2, CEIL, 11", "6, 4, 3, CEIL, 8", "0, 5, 3, CEIL, 0"})
    void mulDivRoundsAsRequested(
            final long x, final long y, final long denominator, final Rounding rounding, final long expected) {
        assertThat(Uint256.mulDiv(
                        BigInteger.valueOf(x), BigInteger.valueOf(y), BigInteger.valueOf(denominator), rounding))
                .isEqualTo(BigInteger.valueOf(expected));
    }

    @Test
    @DisplayName("mulDiv keeps full precision in the intermediate product")
    void mulDivDoesNotOverflowInTheProduct() {
        final var result = Uint256.mulDiv(Uint256.MAX_VALUE, Uint256.MAX_VALUE, Uint256.MAX_VALUE, Rounding.FLOOR);
        assertThat(result).isEqualTo(Uint256.MAX_VALUE);
    }

    @Test
    void mulDivFailsOnOversizedResultOrZeroDenominator() {
        assertOverflow(() -> Uint256.mulDiv(Uint256.MAX_VALUE, TWO, ONE, Rounding.FLOOR));
        assertOverflow(() -> Uint256.mulDiv(ONE, ONE, ZERO, Rounding.FLOOR));
    }

    private static void assertOverflow(final Runnable op) {
        assertThatThrownBy(op::run)
                .isInstanceOf(WrappedTokenException.class)
                .extracting(e -> ((WrappedTokenException) e).getStatus())
                .isEqualTo(ARITHMETIC_OVERFLOW);
    }
}
