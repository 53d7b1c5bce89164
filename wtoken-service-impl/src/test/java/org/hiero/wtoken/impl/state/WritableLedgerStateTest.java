// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.state;

import static java.math.BigInteger.ONE;
import static java.math.BigInteger.TEN;
import static java.math.BigInteger.TWO;
import static java.math.BigInteger.ZERO;
import static org.assertj.core.api.Assertions.assertThat;

import com.esaulpaugh.headlong.abi.Address;
import org.hiero.wtoken.EvmUtils;
import org.junit.jupiter.api.Test;

class WritableLedgerStateTest {
    private static final Address ALICE = EvmUtils.asAddress("0x00000000000000000000000000000000000a11ce");
    private static final Address BOB = EvmUtils.asAddress("0x0000000000000000000000000000000000000b0b");

    private final WritableLedgerState subject = new WritableLedgerState();

    @Test
    void absentEntriesReadAsZero() {
        assertThat(subject.balanceOf(ALICE)).isZero();
        assertThat(subject.allowance(ALICE, BOB)).isZero();
        assertThat(subject.nonceOf(ALICE)).isZero();
        assertThat(subject.totalSupply()).isZero();
    }

    @Test
    void allowancesAreDirectional() {
        subject.putAllowance(ALICE, BOB, TEN);

        assertThat(subject.allowance(ALICE, BOB)).isEqualTo(TEN);
        assertThat(subject.allowance(BOB, ALICE)).isZero();
    }

    @Test
    void resetDropsEveryKindOfWrite() {
        subject.putBalance(ALICE, TEN);
        subject.putAllowance(ALICE, BOB, ONE);
        subject.putNonce(ALICE, ONE);
        subject.putTotalSupply(TEN);

        subject.reset();

        assertThat(subject.balanceOf(ALICE)).isZero();
        assertThat(subject.allowance(ALICE, BOB)).isZero();
        assertThat(subject.nonceOf(ALICE)).isZero();
        assertThat(subject.totalSupply()).isZero();
    }

    @Test
    void commitKeepsEveryKindOfWrite() {
        subject.putBalance(ALICE, TEN);
        subject.putBalance(BOB, TWO);
        subject.putNonce(ALICE, ONE);
        subject.putTotalSupply(TEN.add(TWO));

        subject.commit();
        subject.reset();

        assertThat(subject.balanceOf(ALICE)).isEqualTo(TEN);
        assertThat(subject.nonceOf(ALICE)).isEqualTo(ONE);
        assertThat(subject.balanceOf(BOB)).isEqualTo(TWO);
        assertThat(subject.totalSupply()).isEqualTo(TEN.add(TWO));
    }

    @Test
    void bufferedWritesShadowCommittedOnes() {
        subject.putBalance(ALICE, TEN);
        subject.commit();
        subject.putBalance(ALICE, ZERO);

        assertThat(subject.balanceOf(ALICE)).isZero();
        subject.reset();
        assertThat(subject.balanceOf(ALICE)).isEqualTo(TEN);
    }
}
