// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl;

import static java.util.Objects.requireNonNull;
import static org.hiero.wtoken.EvmUtils.isZero;
import static org.hiero.wtoken.ResponseCode.ALREADY_INITIALIZED;
import static org.hiero.wtoken.ResponseCode.ALREADY_PAUSED;
import static org.hiero.wtoken.ResponseCode.INVALID_ADMIN;
import static org.hiero.wtoken.ResponseCode.NOT_INITIALIZED;
import static org.hiero.wtoken.ResponseCode.NOT_PAUSED;
import static org.hiero.wtoken.WrappedTokenException.validateFalse;
import static org.hiero.wtoken.WrappedTokenException.validateTrue;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.math.BigInteger;
import java.time.InstantSource;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.tuweni.bytes.Bytes32;
import org.hiero.wtoken.AccessController;
import org.hiero.wtoken.Eip712Domain;
import org.hiero.wtoken.PermitSignature;
import org.hiero.wtoken.RebasingAssetSource;
import org.hiero.wtoken.Role;
import org.hiero.wtoken.SignatureRecoverer;
import org.hiero.wtoken.WrappedToken;
import org.hiero.wtoken.WrappedTokenException;
import org.hiero.wtoken.config.WrappedTokenConfig;
import org.hiero.wtoken.impl.crypto.Secp256k1SignatureRecoverer;
import org.hiero.wtoken.impl.crypto.TypedDataHasher;
import org.hiero.wtoken.impl.records.LoggingEventSink;
import org.hiero.wtoken.impl.records.PendingEvents;
import org.hiero.wtoken.impl.state.WritableLedgerState;
import org.hiero.wtoken.records.Initialized;
import org.hiero.wtoken.records.Paused;
import org.hiero.wtoken.records.RoleGranted;
import org.hiero.wtoken.records.RoleRevoked;
import org.hiero.wtoken.records.Unpaused;
import org.hiero.wtoken.records.Upgraded;
import org.hiero.wtoken.records.WrappedTokenEventSink;

/**
 * Default {@link WrappedToken}. Wires the ledger, the transfer gate, the permit authority and the
 * access controller together and makes every operation atomic.
 *
 * <p>Each mutating operation runs inside {@link #execute(Supplier)}: the body writes only to the
 * buffered {@link WritableLedgerState} and to the pending records; both are committed once the body
 * returns and both are dropped if it throws. Operations are serialized on this instance and nested
 * entry from a wrapped asset callback is rejected with {@code REENTRANT_CALL}.
 */
public class WrappedTokenImpl implements WrappedToken {
    private static final Logger logger = LogManager.getLogger(WrappedTokenImpl.class);

    public static final int DECIMALS = 18;
    public static final long INITIAL_VERSION = 1L;

    private final WrappedTokenConfig config;
    private final Address address;
    private final AccessController accessController;
    private final SignatureRecoverer recoverer;
    private final InstantSource time;
    private final WrappedTokenEventSink sink;
    private final TypedDataHasher hasher;
    private final ConversionEngine engine = new ConversionEngine();
    private final WritableLedgerState state = new WritableLedgerState();
    private final PendingEvents pendingEvents = new PendingEvents();
    private final ReentrancyGuard guard = new ReentrancyGuard();

    @Nullable
    private RebasingAssetSource asset;

    @Nullable
    private TransferGate gate;

    @Nullable
    private VaultLedger ledger;

    @Nullable
    private PermitAuthority permits;

    private Address implementation;
    private long implementationVersion;

    /**
     * Creates an uninitialized token with an in-memory role table, secp256k1 signature recovery and
     * the system clock.
     */
    public WrappedTokenImpl(
            @NonNull final WrappedTokenConfig config,
            @NonNull final Address address,
            @NonNull final WrappedTokenEventSink sink) {
        this(config, address, new RoleTable(), new Secp256k1SignatureRecoverer(), InstantSource.system(), sink);
    }

    /**
     * Creates an uninitialized token.
     *
     * @param config the token configuration
     * @param address the address of this token; holds the vault's assets and is the EIP-712 verifying contract
     * @param accessController the role checks administrative operations consult
     * @param recoverer recovers permit signers
     * @param time the clock permit deadlines are checked against
     * @param sink receives the records of every successful operation
     */
    public WrappedTokenImpl(
            @NonNull final WrappedTokenConfig config,
            @NonNull final Address address,
            @NonNull final AccessController accessController,
            @NonNull final SignatureRecoverer recoverer,
            @NonNull final InstantSource time,
            @NonNull final WrappedTokenEventSink sink) {
        this.config = requireNonNull(config);
        this.address = requireNonNull(address);
        this.accessController = requireNonNull(accessController);
        this.recoverer = requireNonNull(recoverer);
        this.time = requireNonNull(time);
        requireNonNull(sink);
        this.sink = config.logEvents() ? new LoggingEventSink(sink) : sink;
        this.hasher = new TypedDataHasher(new Eip712Domain(
                config.name(), Eip712Domain.PERMIT_VERSION, BigInteger.valueOf(config.chainId()), address));
        this.implementation = address;
    }

    // --- lifecycle ---

    @Override
    public synchronized void initialize(@NonNull final RebasingAssetSource asset, @NonNull final Address admin) {
        requireNonNull(asset);
        requireNonNull(admin);
        if (this.asset != null) {
            throw new WrappedTokenException(ALREADY_INITIALIZED, "Initializable: contract is already initialized");
        }
        validateFalse(isZero(admin), INVALID_ADMIN);

        final var newGate = new TransferGate(asset, config.enforceReceiverBan());
        final var newLedger = new VaultLedger(address, asset, engine, newGate, state, pendingEvents);
        this.permits = new PermitAuthority(hasher, recoverer, time, state, newLedger);
        this.gate = newGate;
        this.ledger = newLedger;
        this.asset = asset;
        this.implementationVersion = INITIAL_VERSION;
        accessController.bootstrapAdmin(admin);

        pendingEvents.emit(new RoleGranted(Role.DEFAULT_ADMIN, admin, admin));
        pendingEvents.emit(new Initialized(INITIAL_VERSION));
        pendingEvents.flushTo(sink);
        logger.info(
                "Initialized {} ({}) over asset {} with admin {}",
                config.name(),
                config.symbol(),
                asset.address(),
                admin);
    }

    @Override
    public synchronized boolean isInitialized() {
        return asset != null;
    }

    // --- metadata ---

    @NonNull
    @Override
    public String name() {
        return config.name();
    }

    @NonNull
    @Override
    public String symbol() {
        return config.symbol();
    }

    @Override
    public int decimals() {
        return DECIMALS;
    }

    @NonNull
    @Override
    public Address address() {
        return address;
    }

    @NonNull
    @Override
    public synchronized Address asset() {
        requireInitialized();
        return asset.address();
    }

    @NonNull
    @Override
    public synchronized BigInteger totalAssets() {
        return ledger().totalAssets();
    }

    // --- ERC-20 views ---

    @NonNull
    @Override
    public synchronized BigInteger totalSupply() {
        return ledger().totalSupply();
    }

    @NonNull
    @Override
    public synchronized BigInteger balanceOf(@NonNull final Address account) {
        return ledger().balanceOf(account);
    }

    @NonNull
    @Override
    public synchronized BigInteger allowance(@NonNull final Address owner, @NonNull final Address spender) {
        return ledger().allowance(owner, spender);
    }

    // --- conversion and quotes ---

    @NonNull
    @Override
    public synchronized BigInteger convertToShares(@NonNull final BigInteger assets) {
        return ledger().convertToShares(assets);
    }

    @NonNull
    @Override
    public synchronized BigInteger convertToAssets(@NonNull final BigInteger shares) {
        return ledger().convertToAssets(shares);
    }

    @NonNull
    @Override
    public synchronized BigInteger maxDeposit(@NonNull final Address receiver) {
        return ledger().maxDeposit(receiver);
    }

    @NonNull
    @Override
    public synchronized BigInteger maxMint(@NonNull final Address receiver) {
        return ledger().maxMint(receiver);
    }

    @NonNull
    @Override
    public synchronized BigInteger maxWithdraw(@NonNull final Address owner) {
        return ledger().maxWithdraw(owner);
    }

    @NonNull
    @Override
    public synchronized BigInteger maxRedeem(@NonNull final Address owner) {
        return ledger().maxRedeem(owner);
    }

    @NonNull
    @Override
    public synchronized BigInteger previewDeposit(@NonNull final BigInteger assets) {
        return ledger().previewDeposit(assets);
    }

    @NonNull
    @Override
    public synchronized BigInteger previewMint(@NonNull final BigInteger shares) {
        return ledger().previewMint(shares);
    }

    @NonNull
    @Override
    public synchronized BigInteger previewWithdraw(@NonNull final BigInteger assets) {
        return ledger().previewWithdraw(assets);
    }

    @NonNull
    @Override
    public synchronized BigInteger previewRedeem(@NonNull final BigInteger shares) {
        return ledger().previewRedeem(shares);
    }

    // --- vault operations ---

    @NonNull
    @Override
    public synchronized BigInteger deposit(
            @NonNull final Address caller, @NonNull final BigInteger assets, @NonNull final Address receiver) {
        return execute(() -> ledger.deposit(caller, assets, receiver));
    }

    @NonNull
    @Override
    public synchronized BigInteger mint(
            @NonNull final Address caller, @NonNull final BigInteger shares, @NonNull final Address receiver) {
        return execute(() -> ledger.mint(caller, shares, receiver));
    }

    @NonNull
    @Override
    public synchronized BigInteger withdraw(
            @NonNull final Address caller,
            @NonNull final BigInteger assets,
            @NonNull final Address receiver,
            @NonNull final Address owner) {
        return execute(() -> ledger.withdraw(caller, assets, receiver, owner));
    }

    @NonNull
    @Override
    public synchronized BigInteger redeem(
            @NonNull final Address caller,
            @NonNull final BigInteger shares,
            @NonNull final Address receiver,
            @NonNull final Address owner) {
        return execute(() -> ledger.redeem(caller, shares, receiver, owner));
    }

    // --- ERC-20 operations ---

    @Override
    public synchronized boolean transfer(
            @NonNull final Address caller, @NonNull final Address to, @NonNull final BigInteger amount) {
        return execute(() -> {
            ledger.transfer(caller, to, amount);
            return true;
        });
    }

    @Override
    public synchronized boolean transferFrom(
            @NonNull final Address caller,
            @NonNull final Address from,
            @NonNull final Address to,
            @NonNull final BigInteger amount) {
        return execute(() -> {
            ledger.transferFrom(caller, from, to, amount);
            return true;
        });
    }

    @Override
    public synchronized boolean approve(
            @NonNull final Address caller, @NonNull final Address spender, @NonNull final BigInteger amount) {
        return execute(() -> {
            ledger.approve(caller, spender, amount);
            return true;
        });
    }

    @Override
    public synchronized boolean increaseAllowance(
            @NonNull final Address caller, @NonNull final Address spender, @NonNull final BigInteger addedValue) {
        return execute(() -> {
            ledger.increaseAllowance(caller, spender, addedValue);
            return true;
        });
    }

    @Override
    public synchronized boolean decreaseAllowance(
            @NonNull final Address caller, @NonNull final Address spender, @NonNull final BigInteger subtractedValue) {
        return execute(() -> {
            ledger.decreaseAllowance(caller, spender, subtractedValue);
            return true;
        });
    }

    // --- permit ---

    @Override
    public synchronized void permit(
            @NonNull final Address owner,
            @NonNull final Address spender,
            @NonNull final BigInteger value,
            @NonNull final BigInteger deadline,
            @NonNull final PermitSignature signature) {
        execute(() -> {
            permits.permit(owner, spender, value, deadline, signature);
            return null;
        });
    }

    @NonNull
    @Override
    public synchronized BigInteger nonces(@NonNull final Address owner) {
        requireInitialized();
        return permits.nonces(owner);
    }

    @NonNull
    @Override
    public Bytes32 domainSeparator() {
        return hasher.domainSeparator();
    }

    @NonNull
    @Override
    public Eip712Domain eip712Domain() {
        return hasher.domain();
    }

    // --- administration ---

    @Override
    public synchronized void pause(@NonNull final Address caller) {
        execute(() -> {
            accessController.requireRole(Role.PAUSE, requireNonNull(caller));
            validateFalse(gate.isLocallyPaused(), ALREADY_PAUSED);
            gate.setLocallyPaused(true);
            pendingEvents.emit(new Paused(caller));
            logger.info("{} paused {}", caller, config.symbol());
            return null;
        });
    }

    @Override
    public synchronized void unpause(@NonNull final Address caller) {
        execute(() -> {
            accessController.requireRole(Role.PAUSE, requireNonNull(caller));
            validateTrue(gate.isLocallyPaused(), NOT_PAUSED);
            gate.setLocallyPaused(false);
            pendingEvents.emit(new Unpaused(caller));
            logger.info("{} unpaused {}", caller, config.symbol());
            return null;
        });
    }

    @Override
    public synchronized boolean paused() {
        requireInitialized();
        return gate.isPaused();
    }

    @Override
    public synchronized boolean hasRole(@NonNull final Role role, @NonNull final Address account) {
        requireInitialized();
        return accessController.hasRole(role, account);
    }

    @NonNull
    @Override
    public synchronized Role getRoleAdmin(@NonNull final Role role) {
        requireInitialized();
        return accessController.getRoleAdmin(role);
    }

    @Override
    public synchronized void grantRole(
            @NonNull final Address caller, @NonNull final Role role, @NonNull final Address account) {
        execute(() -> {
            if (accessController.grantRole(caller, role, account)) {
                pendingEvents.emit(new RoleGranted(role, account, caller));
            }
            return null;
        });
    }

    @Override
    public synchronized void revokeRole(
            @NonNull final Address caller, @NonNull final Role role, @NonNull final Address account) {
        execute(() -> {
            if (accessController.revokeRole(caller, role, account)) {
                pendingEvents.emit(new RoleRevoked(role, account, caller));
            }
            return null;
        });
    }

    @Override
    public synchronized void renounceRole(
            @NonNull final Address caller, @NonNull final Role role, @NonNull final Address account) {
        execute(() -> {
            if (accessController.renounceRole(caller, role, account)) {
                pendingEvents.emit(new RoleRevoked(role, account, caller));
            }
            return null;
        });
    }

    @Override
    public synchronized void authorizeUpgrade(@NonNull final Address caller) {
        requireInitialized();
        accessController.requireRole(Role.UPGRADE, requireNonNull(caller));
    }

    @Override
    public synchronized void upgradeTo(@NonNull final Address caller, @NonNull final Address newImplementation) {
        requireNonNull(newImplementation);
        execute(() -> {
            authorizeUpgrade(caller);
            implementation = newImplementation;
            implementationVersion++;
            pendingEvents.emit(new Upgraded(newImplementation));
            logger.info(
                    "{} upgraded {} to {} (version {})",
                    caller,
                    config.symbol(),
                    newImplementation,
                    implementationVersion);
            return null;
        });
    }

    @NonNull
    @Override
    public synchronized Address implementation() {
        return implementation;
    }

    @Override
    public synchronized long implementationVersion() {
        return implementationVersion;
    }

    // --- internals ---

    /**
     * Runs one operation atomically. The body may only write to the ledger state and the pending
     * records; both are discarded if the body throws anything at all. Once the state is committed the
     * operation has happened, and a failing sink can no longer turn it into a failure.
     */
    private <T> T execute(@NonNull final Supplier<T> body) {
        requireInitialized();
        guard.enter();
        var committed = false;
        try {
            final var result = body.get();
            state.commit();
            committed = true;
            pendingEvents.flushTo(sink);
            return result;
        } finally {
            if (!committed) {
                state.reset();
                pendingEvents.clear();
                logger.debug("Rolled back failed operation");
            }
            guard.exit();
        }
    }

    private void requireInitialized() {
        validateTrue(asset != null, NOT_INITIALIZED);
    }

    private VaultLedger ledger() {
        requireInitialized();
        return ledger;
    }
}
