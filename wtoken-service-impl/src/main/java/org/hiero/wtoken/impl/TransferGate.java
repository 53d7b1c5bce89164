// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl;

import static java.util.Objects.requireNonNull;
import static org.hiero.wtoken.ResponseCode.BLOCKED_RECEIVER;
import static org.hiero.wtoken.ResponseCode.BLOCKED_SENDER;
import static org.hiero.wtoken.ResponseCode.TRANSFERS_PAUSED;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.wtoken.BlockedAccountException;
import org.hiero.wtoken.EvmUtils;
import org.hiero.wtoken.RebasingAssetSource;
import org.hiero.wtoken.WrappedTokenException;

/**
 * Decides whether shares may move right now. The wrapped asset's pause flag and ban list are read
 * on every call and never cached, since the asset can change both at any moment.
 */
public class TransferGate {
    private final RebasingAssetSource asset;
    private final boolean enforceReceiverBan;
    private boolean locallyPaused;

    /**
     * @param asset the wrapped asset whose policy is inherited
     * @param enforceReceiverBan whether banned receivers are rejected as well as banned senders
     */
    public TransferGate(@NonNull final RebasingAssetSource asset, final boolean enforceReceiverBan) {
        this.asset = requireNonNull(asset);
        this.enforceReceiverBan = enforceReceiverBan;
    }

    /**
     * @return the local pause flag ORed with the wrapped asset's pause flag
     */
    public boolean isPaused() {
        return locallyPaused || asset.isPaused();
    }

    public boolean isLocallyPaused() {
        return locallyPaused;
    }

    void setLocallyPaused(final boolean paused) {
        this.locallyPaused = paused;
    }

    /**
     * Fails unless shares may move from {@code from} to {@code to}. The zero address stands for a
     * mint source or burn destination and is never checked against the ban list.
     *
     * @throws WrappedTokenException with {@code TRANSFERS_PAUSED} while paused
     * @throws BlockedAccountException if a party is banned
     */
    public void checkTransfer(@NonNull final Address from, @NonNull final Address to) {
        requireNonNull(from);
        requireNonNull(to);
        if (isPaused()) {
            throw new WrappedTokenException(TRANSFERS_PAUSED, "Transfers are paused");
        }
        if (!EvmUtils.isZero(from) && asset.isBanned(from)) {
            throw new BlockedAccountException(BLOCKED_SENDER, from);
        }
        if (enforceReceiverBan && !EvmUtils.isZero(to) && asset.isBanned(to)) {
            throw new BlockedAccountException(BLOCKED_RECEIVER, to);
        }
    }
}
