// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl;

import static java.math.BigInteger.ZERO;
import static java.util.Objects.requireNonNull;
import static org.hiero.wtoken.EvmUtils.ZERO_ADDRESS;
import static org.hiero.wtoken.EvmUtils.isZero;
import static org.hiero.wtoken.ResponseCode.ALLOWANCE_BELOW_ZERO;
import static org.hiero.wtoken.ResponseCode.ASSET_TRANSFER_FAILED;
import static org.hiero.wtoken.ResponseCode.EXCEEDED_MAX_DEPOSIT;
import static org.hiero.wtoken.ResponseCode.EXCEEDED_MAX_MINT;
import static org.hiero.wtoken.ResponseCode.EXCEEDED_MAX_REDEEM;
import static org.hiero.wtoken.ResponseCode.EXCEEDED_MAX_WITHDRAW;
import static org.hiero.wtoken.ResponseCode.INSUFFICIENT_ALLOWANCE;
import static org.hiero.wtoken.ResponseCode.INSUFFICIENT_BALANCE;
import static org.hiero.wtoken.ResponseCode.INVALID_APPROVER;
import static org.hiero.wtoken.ResponseCode.INVALID_RECEIVER;
import static org.hiero.wtoken.ResponseCode.INVALID_SENDER;
import static org.hiero.wtoken.ResponseCode.INVALID_SPENDER;
import static org.hiero.wtoken.WrappedTokenException.validateFalse;
import static org.hiero.wtoken.WrappedTokenException.validateTrue;
import static org.hiero.wtoken.impl.util.Uint256.requireUint256;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.wtoken.RebasingAssetSource;
import org.hiero.wtoken.WrappedTokenException;
import org.hiero.wtoken.impl.ConversionEngine.VaultTotals;
import org.hiero.wtoken.impl.records.PendingEvents;
import org.hiero.wtoken.impl.state.WritableLedgerState;
import org.hiero.wtoken.impl.util.Rounding;
import org.hiero.wtoken.impl.util.Uint256;
import org.hiero.wtoken.records.Approval;
import org.hiero.wtoken.records.Deposit;
import org.hiero.wtoken.records.Transfer;
import org.hiero.wtoken.records.Withdraw;

/**
 * Share balances, supply and allowances of the wrapped token, and the vault operations that move
 * them against the wrapped asset.
 *
 * <p>All writes go to the buffered {@link WritableLedgerState}; committing or resetting it is up
 * to the caller. A reset cannot undo a movement of the wrapped asset, so every check that can fail
 * runs before assets are pulled, and assets are pushed only after shares are burned.
 */
public class VaultLedger {
    private static final Logger logger = LogManager.getLogger(VaultLedger.class);

    private final Address vaultAddress;
    private final RebasingAssetSource asset;
    private final ConversionEngine engine;
    private final TransferGate gate;
    private final WritableLedgerState state;
    private final PendingEvents events;

    public VaultLedger(
            @NonNull final Address vaultAddress,
            @NonNull final RebasingAssetSource asset,
            @NonNull final ConversionEngine engine,
            @NonNull final TransferGate gate,
            @NonNull final WritableLedgerState state,
            @NonNull final PendingEvents events) {
        this.vaultAddress = requireNonNull(vaultAddress);
        this.asset = requireNonNull(asset);
        this.engine = requireNonNull(engine);
        this.gate = requireNonNull(gate);
        this.state = requireNonNull(state);
        this.events = requireNonNull(events);
    }

    // --- views ---

    public BigInteger totalAssets() {
        return asset.balanceOf(vaultAddress);
    }

    public BigInteger totalSupply() {
        return state.totalSupply();
    }

    public BigInteger balanceOf(@NonNull final Address account) {
        return state.balanceOf(requireNonNull(account));
    }

    public BigInteger allowance(@NonNull final Address owner, @NonNull final Address spender) {
        return state.allowance(requireNonNull(owner), requireNonNull(spender));
    }

    public VaultTotals totals() {
        return new VaultTotals(totalAssets(), totalSupply());
    }

    public BigInteger convertToShares(@NonNull final BigInteger assets) {
        return engine.convertToShares(requireUint256(assets), totals(), Rounding.FLOOR);
    }

    public BigInteger convertToAssets(@NonNull final BigInteger shares) {
        return engine.convertToAssets(requireUint256(shares), totals(), Rounding.FLOOR);
    }

    public BigInteger previewDeposit(@NonNull final BigInteger assets) {
        return engine.previewDeposit(requireUint256(assets), totals());
    }

    public BigInteger previewMint(@NonNull final BigInteger shares) {
        return engine.previewMint(requireUint256(shares), totals());
    }

    public BigInteger previewWithdraw(@NonNull final BigInteger assets) {
        return engine.previewWithdraw(requireUint256(assets), totals());
    }

    public BigInteger previewRedeem(@NonNull final BigInteger shares) {
        return engine.previewRedeem(requireUint256(shares), totals());
    }

    public BigInteger maxDeposit(@NonNull final Address receiver) {
        requireNonNull(receiver);
        return gate.isPaused() ? ZERO : Uint256.MAX_VALUE;
    }

    public BigInteger maxMint(@NonNull final Address receiver) {
        requireNonNull(receiver);
        return gate.isPaused() ? ZERO : Uint256.MAX_VALUE;
    }

    public BigInteger maxWithdraw(@NonNull final Address owner) {
        return gate.isPaused() ? ZERO : engine.convertToAssets(balanceOf(owner), totals(), Rounding.FLOOR);
    }

    public BigInteger maxRedeem(@NonNull final Address owner) {
        return gate.isPaused() ? ZERO : balanceOf(owner);
    }

    // --- vault operations ---

    public BigInteger deposit(
            @NonNull final Address caller, @NonNull final BigInteger assets, @NonNull final Address receiver) {
        requireNonNull(caller);
        requireUint256(assets);
        validateFalse(assets.compareTo(maxDeposit(receiver)) > 0, EXCEEDED_MAX_DEPOSIT);
        final var shares = previewDeposit(assets);
        checkMint(receiver, shares);
        pullAssets(caller, assets);
        mintShares(receiver, shares);
        events.emit(new Deposit(caller, receiver, assets, shares));
        logger.debug("{} deposited {} assets for {} shares to {}", caller, assets, shares, receiver);
        return shares;
    }

    public BigInteger mint(
            @NonNull final Address caller, @NonNull final BigInteger shares, @NonNull final Address receiver) {
        requireNonNull(caller);
        requireUint256(shares);
        validateFalse(shares.compareTo(maxMint(receiver)) > 0, EXCEEDED_MAX_MINT);
        final var assets = previewMint(shares);
        checkMint(receiver, shares);
        pullAssets(caller, assets);
        mintShares(receiver, shares);
        events.emit(new Deposit(caller, receiver, assets, shares));
        logger.debug("{} minted {} shares to {} for {} assets", caller, shares, receiver, assets);
        return assets;
    }

    public BigInteger withdraw(
            @NonNull final Address caller,
            @NonNull final BigInteger assets,
            @NonNull final Address receiver,
            @NonNull final Address owner) {
        requireNonNull(caller);
        requireUint256(assets);
        requireNonNull(receiver);
        validateFalse(assets.compareTo(maxWithdraw(owner)) > 0, EXCEEDED_MAX_WITHDRAW);
        final var shares = previewWithdraw(assets);
        exit(caller, receiver, owner, assets, shares);
        return shares;
    }

    public BigInteger redeem(
            @NonNull final Address caller,
            @NonNull final BigInteger shares,
            @NonNull final Address receiver,
            @NonNull final Address owner) {
        requireNonNull(caller);
        requireUint256(shares);
        requireNonNull(receiver);
        validateFalse(shares.compareTo(maxRedeem(owner)) > 0, EXCEEDED_MAX_REDEEM);
        final var assets = previewRedeem(shares);
        exit(caller, receiver, owner, assets, shares);
        return assets;
    }

    private void exit(
            @NonNull final Address caller,
            @NonNull final Address receiver,
            @NonNull final Address owner,
            @NonNull final BigInteger assets,
            @NonNull final BigInteger shares) {
        if (!caller.equals(owner)) {
            spendAllowance(owner, caller, shares);
        }
        burnShares(owner, shares);
        pushAssets(receiver, assets);
        events.emit(new Withdraw(caller, receiver, owner, assets, shares));
        logger.debug("{} redeemed {} shares of {} for {} assets to {}", caller, shares, owner, assets, receiver);
    }

    // --- ERC-20 operations ---

    public void transfer(@NonNull final Address from, @NonNull final Address to, @NonNull final BigInteger amount) {
        requireNonNull(from);
        requireNonNull(to);
        requireUint256(amount);
        validateFalse(isZero(from), INVALID_SENDER);
        validateFalse(isZero(to), INVALID_RECEIVER);
        gate.checkTransfer(from, to);
        final var fromBalance = state.balanceOf(from);
        validateFalse(fromBalance.compareTo(amount) < 0, INSUFFICIENT_BALANCE);
        state.putBalance(from, fromBalance.subtract(amount));
        // re-read, from and to may be the same account
        state.putBalance(to, Uint256.add(state.balanceOf(to), amount));
        events.emit(new Transfer(from, to, amount));
    }

    public void transferFrom(
            @NonNull final Address spender,
            @NonNull final Address from,
            @NonNull final Address to,
            @NonNull final BigInteger amount) {
        requireUint256(amount);
        spendAllowance(from, spender, amount);
        transfer(from, to, amount);
    }

    public void approve(@NonNull final Address owner, @NonNull final Address spender, @NonNull final BigInteger value) {
        requireNonNull(owner);
        requireNonNull(spender);
        requireUint256(value);
        validateFalse(isZero(owner), INVALID_APPROVER);
        validateFalse(isZero(spender), INVALID_SPENDER);
        state.putAllowance(owner, spender, value);
        events.emit(new Approval(owner, spender, value));
    }

    public void increaseAllowance(
            @NonNull final Address owner, @NonNull final Address spender, @NonNull final BigInteger addedValue) {
        requireUint256(addedValue);
        approve(owner, spender, Uint256.add(allowance(owner, spender), addedValue));
    }

    public void decreaseAllowance(
            @NonNull final Address owner, @NonNull final Address spender, @NonNull final BigInteger subtractedValue) {
        requireUint256(subtractedValue);
        final var current = allowance(owner, spender);
        validateFalse(current.compareTo(subtractedValue) < 0, ALLOWANCE_BELOW_ZERO);
        approve(owner, spender, current.subtract(subtractedValue));
    }

    /**
     * Consumes {@code amount} of the allowance {@code owner} gave {@code spender}. An allowance of
     * {@code 2^256 - 1} is unlimited and is left untouched.
     */
    void spendAllowance(
            @NonNull final Address owner, @NonNull final Address spender, @NonNull final BigInteger amount) {
        final var current = allowance(owner, spender);
        if (current.equals(Uint256.MAX_VALUE)) {
            return;
        }
        validateFalse(current.compareTo(amount) < 0, INSUFFICIENT_ALLOWANCE);
        approve(owner, spender, current.subtract(amount));
    }

    // --- supply changes ---

    /**
     * Fails if {@code shares} could not be minted to {@code to} right now.
     */
    private void checkMint(@NonNull final Address to, @NonNull final BigInteger shares) {
        requireNonNull(to);
        validateFalse(isZero(to), INVALID_RECEIVER);
        gate.checkTransfer(ZERO_ADDRESS, to);
        Uint256.add(state.totalSupply(), shares);
    }

    private void mintShares(@NonNull final Address to, @NonNull final BigInteger shares) {
        checkMint(to, shares);
        state.putTotalSupply(Uint256.add(state.totalSupply(), shares));
        state.putBalance(to, Uint256.add(state.balanceOf(to), shares));
        events.emit(new Transfer(ZERO_ADDRESS, to, shares));
    }

    private void burnShares(@NonNull final Address from, @NonNull final BigInteger shares) {
        requireNonNull(from);
        validateFalse(isZero(from), INVALID_SENDER);
        gate.checkTransfer(from, ZERO_ADDRESS);
        final var fromBalance = state.balanceOf(from);
        validateTrue(fromBalance.compareTo(shares) >= 0, INSUFFICIENT_BALANCE);
        state.putBalance(from, fromBalance.subtract(shares));
        state.putTotalSupply(Uint256.sub(state.totalSupply(), shares));
        events.emit(new Transfer(from, ZERO_ADDRESS, shares));
    }

    // --- asset movements ---

    private void pullAssets(@NonNull final Address from, @NonNull final BigInteger assets) {
        try {
            asset.transferFrom(vaultAddress, from, vaultAddress, assets);
        } catch (WrappedTokenException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WrappedTokenException(
                    ASSET_TRANSFER_FAILED, "Could not pull " + assets + " assets from " + from, e);
        }
    }

    private void pushAssets(@NonNull final Address to, @NonNull final BigInteger assets) {
        try {
            asset.transfer(vaultAddress, to, assets);
        } catch (WrappedTokenException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WrappedTokenException(ASSET_TRANSFER_FAILED, "Could not push " + assets + " assets to " + to, e);
        }
    }
}
