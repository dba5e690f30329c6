// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;

/**
 * Thrown when an operation that needs a client and fee rate runs before {@code initialize}.
 *
 * @since 0.1.0
 */
public final class NotInitializedException extends ProxyException {

    public NotInitializedException(final String operation) {
        super(operation + " requires an initialized proxy");
    }
}
