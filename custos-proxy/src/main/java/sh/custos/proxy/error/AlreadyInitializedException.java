// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;
import sh.custos.core.types.Address;

/**
 * Thrown by a second call to {@code initialize}; client and fee rate are fixed once.
 *
 * @since 0.1.0
 */
public final class AlreadyInitializedException extends ProxyException {

    public AlreadyInitializedException(final Address client) {
        super("proxy already initialized for client " + client);
    }
}
