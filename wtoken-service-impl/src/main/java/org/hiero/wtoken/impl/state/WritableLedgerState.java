// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.state;

import static java.math.BigInteger.ZERO;
import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;

/**
 * All mutable ledger state of the wrapped token: share balances, total supply, allowances and
 * permit nonces. Every operation writes into the buffers and the owner of this instance either
 * commits or resets them as a whole.
 *
 * <p>Absent entries read as zero, so an entry comes into existence on its first write and is never
 * removed.
 */
public class WritableLedgerState {
    private final WritableKVState<Address, BigInteger> balances = new WritableKVState<>();
    private final WritableKVState<AllowanceKey, BigInteger> allowances = new WritableKVState<>();
    private final WritableKVState<Address, BigInteger> nonces = new WritableKVState<>();
    private final WritableSingletonState<BigInteger> totalSupply = new WritableSingletonState<>(ZERO);

    public BigInteger balanceOf(@NonNull final Address account) {
        return balances.getOrDefault(account, ZERO);
    }

    public void putBalance(@NonNull final Address account, @NonNull final BigInteger balance) {
        balances.put(account, balance);
    }

    public BigInteger allowance(@NonNull final Address owner, @NonNull final Address spender) {
        return allowances.getOrDefault(new AllowanceKey(owner, spender), ZERO);
    }

    public void putAllowance(
            @NonNull final Address owner, @NonNull final Address spender, @NonNull final BigInteger value) {
        allowances.put(new AllowanceKey(owner, spender), value);
    }

    public BigInteger nonceOf(@NonNull final Address owner) {
        return nonces.getOrDefault(owner, ZERO);
    }

    public void putNonce(@NonNull final Address owner, @NonNull final BigInteger nonce) {
        nonces.put(owner, nonce);
    }

    public BigInteger totalSupply() {
        return totalSupply.get();
    }

    public void putTotalSupply(@NonNull final BigInteger supply) {
        totalSupply.put(requireNonNull(supply));
    }

    /**
     * Applies every buffered write.
     */
    public void commit() {
        balances.commit();
        allowances.commit();
        nonces.commit();
        totalSupply.commit();
    }

    /**
     * Drops every buffered write.
     */
    public void reset() {
        balances.reset();
        allowances.reset();
        nonces.reset();
        totalSupply.reset();
    }
}
