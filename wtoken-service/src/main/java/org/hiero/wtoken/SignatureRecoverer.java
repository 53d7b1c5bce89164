// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import com.esaulpaugh.headlong.abi.Address;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Optional;
import org.apache.tuweni.bytes.Bytes32;

/**
 * Recovers the account that signed a 32-byte digest.
 */
@FunctionalInterface
public interface SignatureRecoverer {

    /**
     * @param digest the signed digest
     * @param signature the signature components
     * @return the signing address, or empty if the signature is malformed or recovers no key
     */
    @NonNull
    Optional<Address> recoverSigner(@NonNull Bytes32 digest, @NonNull PermitSignature signature);
}
