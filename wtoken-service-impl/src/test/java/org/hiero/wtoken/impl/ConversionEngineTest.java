// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl;

import static java.math.BigInteger.ZERO;
import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import org.hiero.wtoken.impl.ConversionEngine.VaultTotals;
import org.hiero.wtoken.impl.util.Rounding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConversionEngineTest {
    private static final BigInteger E18 = BigInteger.TEN.pow(18);

    private final ConversionEngine subject = new ConversionEngine();

    @Nested
    @DisplayName("An empty vault")
    class EmptyVault {
        private final VaultTotals totals = new VaultTotals(ZERO, ZERO);

        @Test
        void convertsOneToOne() {
            final var amount = BigInteger.valueOf(1234);
            assertThat(subject.convertToShares(amount, totals, Rounding.FLOOR)).isEqualTo(amount);
            assertThat(subject.convertToAssets(amount, totals, Rounding.FLOOR)).isEqualTo(amount);
            assertThat(subject.previewDeposit(amount, totals)).isEqualTo(amount);
            assertThat(subject.previewMint(amount, totals)).isEqualTo(amount);
            assertThat(subject.previewWithdraw(amount, totals)).isEqualTo(amount);
            assertThat(subject.previewRedeem(amount, totals)).isEqualTo(amount);
        }

        @Test
        @DisplayName("with outstanding shares but no assets still takes deposits 1:1")
        void sharesWithoutAssets() {
            final var drained = new VaultTotals(ZERO, E18);
            assertThat(subject.convertToShares(E18, drained, Rounding.FLOOR)).isEqualTo(E18);
        }
    }

    @Nested
    @DisplayName("A vault that has accrued value")
    class AccruedVault {
        // 1 share minted at multiplier 1.0, asset multiplier now 1.1
        private final VaultTotals totals = new VaultTotals(new BigInteger("1100000000000000000"), E18);

        @Test
        void redeemRoundsDownAndMintRoundsUp() {
            assertThat(subject.previewRedeem(E18, totals)).isEqualTo(new BigInteger("1099999999999999999"));
            assertThat(subject.previewMint(E18, totals)).isEqualTo(new BigInteger("1100000000000000000"));
        }

        @Test
        void depositRoundsDownAndWithdrawRoundsUp() {
            final var assets = BigInteger.valueOf(11);
            final var down = subject.previewDeposit(assets, totals);
            final var up = subject.previewWithdraw(assets, totals);
            assertThat(down).isEqualTo(BigInteger.TEN);
            assertThat(up).isEqualTo(down.add(BigInteger.ONE));
        }

        @Test
        @DisplayName("never quotes a round trip that creates value")
        void roundTripNeverGains() {
            for (long amount = 1; amount < 50; amount++) {
                final var assets = BigInteger.valueOf(amount);
                final var shares = subject.previewDeposit(assets, totals);
                assertThat(subject.previewRedeem(shares, totals)).isLessThanOrEqualTo(assets);
                final var cost = subject.previewMint(shares, totals);
                assertThat(cost).isLessThanOrEqualTo(assets);
                assertThat(subject.previewWithdraw(subject.previewRedeem(shares, totals), totals))
                        .isLessThanOrEqualTo(shares);
            }
        }
    }

    @Test
    void conversionAtUnitRateIsExact() {
        final var held = new BigInteger("1337000000000000000000");
        final var totals = new VaultTotals(held, held);
        assertThat(subject.previewRedeem(E18, totals)).isEqualTo(E18);
        assertThat(subject.previewWithdraw(E18, totals)).isEqualTo(E18);
    }
}
