// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import org.apache.tuweni.bytes.Bytes32;

/**
 * A non-rebasing share token over a rebasing asset. Holders own shares; the asset value of a share
 * grows as the wrapped asset's multiplier grows, without any share balance changing.
 *
 * <p>Mutating operations take the calling account explicitly. Each operation is atomic: it either
 * applies all of its share and asset movements or throws a {@link WrappedTokenException} and
 * leaves nothing behind. Amounts are unsigned 256-bit integers.
 */
public interface WrappedToken {

    // --- lifecycle ---

    /**
     * Binds the token to the asset it wraps and grants {@link Role#DEFAULT_ADMIN} to {@code admin}.
     * May succeed at most once per instance.
     *
     * @param asset the wrapped asset
     * @param admin the initial administrator
     * @throws WrappedTokenException with {@link ResponseCode#ALREADY_INITIALIZED} on any later call
     */
    void initialize(@NonNull RebasingAssetSource asset, @NonNull Address admin);

    boolean isInitialized();

    // --- metadata ---

    @NonNull
    String name();

    @NonNull
    String symbol();

    int decimals();

    /**
     * @return the address of this token
     */
    @NonNull
    Address address();

    /**
     * @return the address of the wrapped asset
     */
    @NonNull
    Address asset();

    /**
     * @return the wrapped asset balance currently held by the vault
     */
    @NonNull
    BigInteger totalAssets();

    // --- ERC-20 views ---

    @NonNull
    BigInteger totalSupply();

    @NonNull
    BigInteger balanceOf(@NonNull Address account);

    @NonNull
    BigInteger allowance(@NonNull Address owner, @NonNull Address spender);

    // --- conversion and quotes ---

    @NonNull
    BigInteger convertToShares(@NonNull BigInteger assets);

    @NonNull
    BigInteger convertToAssets(@NonNull BigInteger shares);

    @NonNull
    BigInteger maxDeposit(@NonNull Address receiver);

    @NonNull
    BigInteger maxMint(@NonNull Address receiver);

    @NonNull
    BigInteger maxWithdraw(@NonNull Address owner);

    @NonNull
    BigInteger maxRedeem(@NonNull Address owner);

    @NonNull
    BigInteger previewDeposit(@NonNull BigInteger assets);

    @NonNull
    BigInteger previewMint(@NonNull BigInteger shares);

    @NonNull
    BigInteger previewWithdraw(@NonNull BigInteger assets);

    @NonNull
    BigInteger previewRedeem(@NonNull BigInteger shares);

    // --- vault operations ---

    /**
     * Pulls {@code assets} from the caller and credits the resulting shares to {@code receiver}.
     *
     * @return the shares credited
     */
    @NonNull
    BigInteger deposit(@NonNull Address caller, @NonNull BigInteger assets, @NonNull Address receiver);

    /**
     * Credits exactly {@code shares} to {@code receiver}, pulling the assets they cost from the caller.
     *
     * @return the assets pulled
     */
    @NonNull
    BigInteger mint(@NonNull Address caller, @NonNull BigInteger shares, @NonNull Address receiver);

    /**
     * Burns the shares of {@code owner} worth {@code assets} and sends exactly {@code assets} to
     * {@code receiver}. A caller other than the owner spends its allowance.
     *
     * @return the shares burned
     */
    @NonNull
    BigInteger withdraw(
            @NonNull Address caller, @NonNull BigInteger assets, @NonNull Address receiver, @NonNull Address owner);

    /**
     * Burns exactly {@code shares} of {@code owner} and sends their asset value to {@code receiver}.
     * A caller other than the owner spends its allowance.
     *
     * @return the assets sent
     */
    @NonNull
    BigInteger redeem(
            @NonNull Address caller, @NonNull BigInteger shares, @NonNull Address receiver, @NonNull Address owner);

    // --- ERC-20 operations ---

    boolean transfer(@NonNull Address caller, @NonNull Address to, @NonNull BigInteger amount);

    boolean transferFrom(
            @NonNull Address caller, @NonNull Address from, @NonNull Address to, @NonNull BigInteger amount);

    boolean approve(@NonNull Address caller, @NonNull Address spender, @NonNull BigInteger amount);

    boolean increaseAllowance(@NonNull Address caller, @NonNull Address spender, @NonNull BigInteger addedValue);

    boolean decreaseAllowance(
            @NonNull Address caller, @NonNull Address spender, @NonNull BigInteger subtractedValue);

    // --- permit ---

    /**
     * Sets the allowance of {@code spender} over the shares of {@code owner} from an owner-signed
     * EIP-712 message. Anyone may submit it; it can be used once.
     *
     * @throws ExpiredDeadlineException if the deadline has passed
     * @throws InvalidSignatureException if the signature is malformed, not the owner's, or replayed
     */
    void permit(
            @NonNull Address owner,
            @NonNull Address spender,
            @NonNull BigInteger value,
            @NonNull BigInteger deadline,
            @NonNull PermitSignature signature);

    @NonNull
    BigInteger nonces(@NonNull Address owner);

    @NonNull
    Bytes32 domainSeparator();

    @NonNull
    Eip712Domain eip712Domain();

    // --- administration ---

    void pause(@NonNull Address caller);

    void unpause(@NonNull Address caller);

    /**
     * @return whether either this token or the wrapped asset is paused
     */
    boolean paused();

    boolean hasRole(@NonNull Role role, @NonNull Address account);

    @NonNull
    Role getRoleAdmin(@NonNull Role role);

    void grantRole(@NonNull Address caller, @NonNull Role role, @NonNull Address account);

    void revokeRole(@NonNull Address caller, @NonNull Role role, @NonNull Address account);

    void renounceRole(@NonNull Address caller, @NonNull Role role, @NonNull Address account);

    /**
     * The hook an external upgrade mechanism consults before swapping the implementation.
     *
     * @throws UnauthorizedException if the caller lacks {@link Role#UPGRADE}
     */
    void authorizeUpgrade(@NonNull Address caller);

    /**
     * Authorizes and records a new implementation.
     */
    void upgradeTo(@NonNull Address caller, @NonNull Address newImplementation);

    @NonNull
    Address implementation();

    long implementationVersion();
}
