// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.config;

import com.google.auto.service.AutoService;
import com.swirlds.config.api.ConfigurationExtension;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Set;

/**
 * Registers the wrapped token config data types for auto discovery.
 */
@AutoService(ConfigurationExtension.class)
public final class WrappedTokenConfigurationExtension implements ConfigurationExtension {

    @NonNull
    @Override
    public Set<Class<? extends Record>> getConfigDataTypes() {
        return Set.of(WrappedTokenConfig.class);
    }
}
