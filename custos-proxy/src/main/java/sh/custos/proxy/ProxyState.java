// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

/**
 * Lifecycle of a proxy instance.
 *
 * @since 0.1.0
 */
public enum ProxyState {
    /** Created, client and fee rate not yet set. */
    UNINITIALIZED,
    /** Initialized exactly once; stays active for the life of the instance. */
    ACTIVE
}
