// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

import static java.util.Objects.requireNonNull;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A new implementation was authorized.
 */
public record Upgraded(@NonNull Address implementation) implements WrappedTokenEvent {
    public Upgraded {
        requireNonNull(implementation);
    }
}
