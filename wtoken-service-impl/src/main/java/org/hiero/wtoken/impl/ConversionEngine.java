// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl;

import static java.util.Objects.requireNonNull;
import static org.hiero.wtoken.impl.util.Uint256.mulDiv;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import org.hiero.wtoken.impl.util.Rounding;

/**
 * Converts between shares and assets at the vault's current rate. Every quote rounds in the vault's
 * favour, so the rounding residue can only ever grow the vault's surplus.
 *
 * <p>While shares are outstanding the rate carries one virtual share and one virtual asset, so
 * {@code shares -> assets} is {@code shares * (totalAssets + 1) / (totalSupply + 1)}. A vault with
 * no shares, or with no assets when converting to shares, converts 1:1.
 */
public final class ConversionEngine {

    /**
     * The inputs every conversion is quoted against.
     *
     * @param totalAssets the asset balance held by the vault
     * @param totalSupply the outstanding shares
     */
    public record VaultTotals(@NonNull BigInteger totalAssets, @NonNull BigInteger totalSupply) {
        public VaultTotals {
            requireNonNull(totalAssets);
            requireNonNull(totalSupply);
        }
    }

    public BigInteger convertToShares(
            @NonNull final BigInteger assets, @NonNull final VaultTotals totals, @NonNull final Rounding rounding) {
        requireNonNull(assets);
        if (totals.totalSupply().signum() == 0 || totals.totalAssets().signum() == 0) {
            return assets;
        }
        return mulDiv(
                assets, totals.totalSupply().add(BigInteger.ONE), totals.totalAssets().add(BigInteger.ONE), rounding);
    }

    public BigInteger convertToAssets(
            @NonNull final BigInteger shares, @NonNull final VaultTotals totals, @NonNull final Rounding rounding) {
        requireNonNull(shares);
        if (totals.totalSupply().signum() == 0) {
            return shares;
        }
        return mulDiv(
                shares, totals.totalAssets().add(BigInteger.ONE), totals.totalSupply().add(BigInteger.ONE), rounding);
    }

    /** Shares a deposit of {@code assets} earns; rounded down. */
    public BigInteger previewDeposit(@NonNull final BigInteger assets, @NonNull final VaultTotals totals) {
        return convertToShares(assets, totals, Rounding.FLOOR);
    }

    /** Assets a mint of {@code shares} costs; rounded up. */
    public BigInteger previewMint(@NonNull final BigInteger shares, @NonNull final VaultTotals totals) {
        return convertToAssets(shares, totals, Rounding.CEIL);
    }

    /** Shares a withdrawal of {@code assets} burns; rounded up. */
    public BigInteger previewWithdraw(@NonNull final BigInteger assets, @NonNull final VaultTotals totals) {
        return convertToShares(assets, totals, Rounding.CEIL);
    }

    /** Assets a redemption of {@code shares} pays out; rounded down. */
    public BigInteger previewRedeem(@NonNull final BigInteger shares, @NonNull final VaultTotals totals) {
        return convertToAssets(shares, totals, Rounding.FLOOR);
    }
}
