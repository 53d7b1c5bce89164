// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.impl.util;

/**
 * Direction in which an inexact quotient is rounded.
 */
public enum Rounding {
    /** Toward zero. */
    FLOOR,
    /** Away from zero. */
    CEIL
}
