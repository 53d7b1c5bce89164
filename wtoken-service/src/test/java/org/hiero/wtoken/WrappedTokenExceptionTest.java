// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.esaulpaugh.headlong.abi.Address;
import java.math.BigInteger;
import org.apache.tuweni.bytes.Bytes32;
import org.junit.jupiter.api.Test;

class WrappedTokenExceptionTest {
    private static final Address ACCOUNT =
            EvmUtils.asAddress("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");

    @Test
    void validatesFlags() {
        assertThatCode(() -> WrappedTokenException.validateTrue(true, ResponseCode.INVALID_AMOUNT))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> WrappedTokenException.validateFalse(true, ResponseCode.INVALID_AMOUNT))
                .isInstanceOf(WrappedTokenException.class)
                .hasMessage("INVALID_AMOUNT");
    }

    @Test
    void rolesUseTheirHashedNames() {
        assertThat(Role.DEFAULT_ADMIN.id()).isEqualTo(Bytes32.ZERO);
        assertThat(Role.PAUSE.id().toHexString())
                .isEqualTo("0x139c2898040ef16910dc9f44dc697df79363da767d8bc92f2e310312b816e46d");
        assertThat(Role.UPGRADE.id().toHexString())
                .isEqualTo("0x88aa719609f728b0c5e7fb8dd3608d5c25d497efbb3b9dd64e9251ebba101508");
    }

    @Test
    void missingRoleReadsLikeAccessControl() {
        final var e = new UnauthorizedException(ACCOUNT, Role.PAUSE);

        assertThat(e.getStatus()).isEqualTo(ResponseCode.UNAUTHORIZED);
        assertThat(e.getMessage())
                .isEqualTo("AccessControl: account 0x70997970c51812dc3a010c7d01b50e0d17dc79c8 is missing role "
                        + "0x139c2898040ef16910dc9f44dc697df79363da767d8bc92f2e310312b816e46d");
    }

    @Test
    void blockedAccountNeedsABanStatus() {
        assertThat(new BlockedAccountException(ResponseCode.BLOCKED_RECEIVER, ACCOUNT).account())
                .isEqualTo(ACCOUNT);
        assertThatThrownBy(() -> new BlockedAccountException(ResponseCode.INVALID_AMOUNT, ACCOUNT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void expiredDeadlineCarriesBothTimes() {
        final var e = new ExpiredDeadlineException(BigInteger.TEN, BigInteger.valueOf(11));

        assertThat(e.getStatus()).isEqualTo(ResponseCode.EXPIRED_DEADLINE);
        assertThat(e.deadline()).isEqualTo(BigInteger.TEN);
        assertThat(e.now()).isEqualTo(BigInteger.valueOf(11));
    }
}
