// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.config;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.validation.annotation.Min;

/**
 * Wrapped token configuration properties.
 *
 * @param name the token name, also used as the name of the EIP-712 signing domain
 * @param symbol the token symbol
 * @param chainId the chain id bound into the EIP-712 signing domain
 * @param enforceReceiverBan whether a receiver on the wrapped asset's ban list is rejected, in addition to the sender
 * @param logEvents whether every emitted record is also written to the log
 */
@ConfigData("wtoken")
public record WrappedTokenConfig(
        @ConfigProperty(defaultValue = "Wrapped OpenEden Protocol USD") String name,
        @ConfigProperty(defaultValue = "wUSDO") String symbol,
        @ConfigProperty(defaultValue = "1") @Min(0) long chainId,
        @ConfigProperty(value = "gate.enforceReceiverBan", defaultValue = "true") boolean enforceReceiverBan,
        @ConfigProperty(value = "events.logEnabled", defaultValue = "true") boolean logEvents) {}
