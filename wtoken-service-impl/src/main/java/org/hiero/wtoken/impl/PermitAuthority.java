// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl;

import static java.util.Objects.requireNonNull;
import static org.hiero.wtoken.impl.util.Uint256.requireUint256;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import java.time.InstantSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.tuweni.bytes.Bytes32;
import org.hiero.wtoken.Eip712Domain;
import org.hiero.wtoken.ExpiredDeadlineException;
import org.hiero.wtoken.InvalidSignatureException;
import org.hiero.wtoken.PermitSignature;
import org.hiero.wtoken.SignatureRecoverer;
import org.hiero.wtoken.impl.crypto.TypedDataHasher;
import org.hiero.wtoken.impl.state.WritableLedgerState;
import org.hiero.wtoken.impl.util.Uint256;

/**
 * Turns owner-signed EIP-712 permit messages into allowances. Each owner has a nonce that is bound
 * into the signed message and consumed by the permit, so a signature is good for exactly one use.
 */
public class PermitAuthority {
    private static final Logger logger = LogManager.getLogger(PermitAuthority.class);

    private final TypedDataHasher hasher;
    private final SignatureRecoverer recoverer;
    private final InstantSource time;
    private final WritableLedgerState state;
    private final VaultLedger ledger;

    public PermitAuthority(
            @NonNull final TypedDataHasher hasher,
            @NonNull final SignatureRecoverer recoverer,
            @NonNull final InstantSource time,
            @NonNull final WritableLedgerState state,
            @NonNull final VaultLedger ledger) {
        this.hasher = requireNonNull(hasher);
        this.recoverer = requireNonNull(recoverer);
        this.time = requireNonNull(time);
        this.state = requireNonNull(state);
        this.ledger = requireNonNull(ledger);
    }

    /**
     * Verifies the permit and sets {@code allowance[owner][spender] = value}.
     *
     * @throws ExpiredDeadlineException if the current epoch second is past {@code deadline}
     * @throws InvalidSignatureException if the signature does not recover to {@code owner}
     */
    public void permit(
            @NonNull final Address owner,
            @NonNull final Address spender,
            @NonNull final BigInteger value,
            @NonNull final BigInteger deadline,
            @NonNull final PermitSignature signature) {
        requireNonNull(owner);
        requireNonNull(spender);
        requireUint256(value);
        requireUint256(deadline);
        requireNonNull(signature);

        final var now = BigInteger.valueOf(time.instant().getEpochSecond());
        if (now.compareTo(deadline) > 0) {
            logger.warn("Rejected permit of {} for {}, deadline {} passed at {}", owner, spender, deadline, now);
            throw new ExpiredDeadlineException(deadline, now);
        }

        final var nonce = state.nonceOf(owner);
        final var digest = hasher.permitDigest(owner, spender, value, nonce, deadline);
        final var signer = recoverer.recoverSigner(digest, signature);
        if (signer.isEmpty() || !signer.get().equals(owner)) {
            logger.warn("Rejected permit of {} for {}, signature does not match nonce {}", owner, spender, nonce);
            throw new InvalidSignatureException(owner, spender);
        }

        state.putNonce(owner, Uint256.add(nonce, BigInteger.ONE));
        ledger.approve(owner, spender, value);
    }

    public BigInteger nonces(@NonNull final Address owner) {
        return state.nonceOf(requireNonNull(owner));
    }

    public Bytes32 domainSeparator() {
        return hasher.domainSeparator();
    }

    public Eip712Domain eip712Domain() {
        return hasher.domain();
    }
}
