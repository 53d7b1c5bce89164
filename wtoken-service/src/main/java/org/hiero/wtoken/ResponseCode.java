// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken;

/**
 * Every condition under which a wrapped token operation is rejected.
 */
public enum ResponseCode {
    /** The wrapped token or the wrapped asset is paused. */
    TRANSFERS_PAUSED,
    /** The sending account is on the wrapped asset's ban list. */
    BLOCKED_SENDER,
    /** The receiving account is on the wrapped asset's ban list. */
    BLOCKED_RECEIVER,
    INVALID_SIGNATURE,
    EXPIRED_DEADLINE,
    /** The calling account is missing a required role. */
    UNAUTHORIZED,
    ALREADY_INITIALIZED,
    NOT_INITIALIZED,
    INVALID_ADMIN,
    INVALID_SENDER,
    INVALID_RECEIVER,
    INVALID_APPROVER,
    INVALID_SPENDER,
    /** An amount is negative or wider than 256 bits. */
    INVALID_AMOUNT,
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_ALLOWANCE,
    ALLOWANCE_BELOW_ZERO,
    EXCEEDED_MAX_DEPOSIT,
    EXCEEDED_MAX_MINT,
    EXCEEDED_MAX_WITHDRAW,
    EXCEEDED_MAX_REDEEM,
    ALREADY_PAUSED,
    NOT_PAUSED,
    CAN_ONLY_RENOUNCE_FOR_SELF,
    /** An arithmetic result does not fit in 256 bits, or would be negative. */
    ARITHMETIC_OVERFLOW,
    /** The wrapped asset refused to move funds. */
    ASSET_TRANSFER_FAILED,
    /** An operation was entered again from inside an external call it made. */
    REENTRANT_CALL
}
