// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a wrapped token operation is rejected. The operation that threw it has left no state
 * change behind.
 */
public class WrappedTokenException extends RuntimeException {
    private final ResponseCode status;

    public WrappedTokenException(@NonNull final ResponseCode status) {
        this(status, status.name());
    }

    public WrappedTokenException(@NonNull final ResponseCode status, @NonNull final String message) {
        super(message);
        this.status = requireNonNull(status);
    }

    public WrappedTokenException(
            @NonNull final ResponseCode status, @NonNull final String message, @NonNull final Throwable cause) {
        super(message, cause);
        this.status = requireNonNull(status);
    }

    public ResponseCode getStatus() {
        return status;
    }

    /**
     * Throws a {@link WrappedTokenException} with the given status if the flag is false.
     *
     * @param flag the condition that must hold
     * @param code the status to fail with
     */
    public static void validateTrue(final boolean flag, @NonNull final ResponseCode code) {
        if (!flag) {
            throw new WrappedTokenException(code);
        }
    }

    public static void validateFalse(final boolean flag, @NonNull final ResponseCode code) {
        validateTrue(!flag, code);
    }

    @Override
    public String toString() {
        return "WrappedTokenException{status=" + status + ", message=" + getMessage() + "}";
    }
}
