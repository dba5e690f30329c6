// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

/**
 * Declared purpose of a forwarded instruction, passed to the allow-list checker
 * so it can apply kind-specific rules.
 *
 * @since 0.1.0
 */
public enum OperationKind {
    DEPOSIT,
    WITHDRAWAL,
    ANY_FUNCTION
}
