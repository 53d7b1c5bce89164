// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;

/**
 * The rebasing, interest-bearing asset wrapped by the vault. It is the only source of truth for the
 * vault's asset holdings and for the pause and ban policy the vault inherits.
 *
 * <p>Every method is a synchronous call into the asset; implementations signal a refused movement
 * by throwing, and the vault then aborts the whole operation. The vault never caches any answer.
 */
public interface RebasingAssetSource {

    /**
     * @return the address of the asset
     */
    @NonNull
    Address address();

    /**
     * Returns the current, multiplier-adjusted balance of the account.
     *
     * @param account the account to query
     * @return the balance in asset units
     */
    @NonNull
    BigInteger balanceOf(@NonNull Address account);

    /**
     * Moves {@code amount} from {@code from} to {@code to}, consuming the allowance {@code from} gave
     * to {@code spender}.
     *
     * @throws RuntimeException if the asset refuses the movement
     */
    void transferFrom(@NonNull Address spender, @NonNull Address from, @NonNull Address to, @NonNull BigInteger amount);

    /**
     * Moves {@code amount} out of the balance of {@code from}.
     *
     * @throws RuntimeException if the asset refuses the movement
     */
    void transfer(@NonNull Address from, @NonNull Address to, @NonNull BigInteger amount);

    /**
     * @return whether the asset itself is currently paused
     */
    boolean isPaused();

    /**
     * @param account the account to check
     * @return whether the account is currently on the asset's ban list
     */
    boolean isBanned(@NonNull Address account);
}
