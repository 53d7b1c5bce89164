// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.swirlds.config.api.ConfigurationBuilder;
import org.junit.jupiter.api.Test;

class WrappedTokenConfigTest {

    @Test
    void defaultValues() {
        final WrappedTokenConfig config =
                configBuilder().build().getConfigData(WrappedTokenConfig.class);

        assertThat(config.name()).isEqualTo("Wrapped OpenEden Protocol USD");
        assertThat(config.symbol()).isEqualTo("wUSDO");
        assertThat(config.chainId()).isEqualTo(1L);
        assertThat(config.enforceReceiverBan())
                .as("Receiver side ban check must be on by default.")
                .isTrue();
        assertThat(config.logEvents()).isTrue();
    }

    @Test
    void nonDefaultValues() {
        final WrappedTokenConfig config = configBuilder()
                .withValue("wtoken.name", "Wrapped Test Dollar")
                .withValue("wtoken.symbol", "wTD")
                .withValue("wtoken.chainId", "31337")
                .withValue("wtoken.gate.enforceReceiverBan", "false")
                .withValue("wtoken.events.logEnabled", "false")
                .build()
                .getConfigData(WrappedTokenConfig.class);

        assertThat(config.name()).isEqualTo("Wrapped Test Dollar");
        assertThat(config.symbol()).isEqualTo("wTD");
        assertThat(config.chainId()).isEqualTo(31337L);
        assertThat(config.enforceReceiverBan()).isFalse();
        assertThat(config.logEvents()).isFalse();
    }

    @Test
    void negativeChainIdIsRejected() {
        assertThatThrownBy(() -> configBuilder().withValue("wtoken.chainId", "-1").build())
                .isInstanceOf(RuntimeException.class);
    }

    @Test
    void extensionIsDiscovered() {
        final WrappedTokenConfig config = ConfigurationBuilder.create()
                .autoDiscoverExtensions()
                .build()
                .getConfigData(WrappedTokenConfig.class);

        assertThat(config.symbol()).isEqualTo("wUSDO");
        assertThat(new WrappedTokenConfigurationExtension().getConfigDataTypes())
                .containsExactly(WrappedTokenConfig.class);
    }

    private static ConfigurationBuilder configBuilder() {
        return ConfigurationBuilder.create().withConfigDataType(WrappedTokenConfig.class);
    }
}
