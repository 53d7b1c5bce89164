// SPDX-License-Identifier: Apache-2.0
package org.hiero.wtoken.records;

/**
 * The wrapped token was initialized at the given version.
 */
public record Initialized(long version) implements WrappedTokenEvent {}
