// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;

/**
 * Thrown when a guarded operation is entered while another guarded operation is in progress.
 *
 * @since 0.1.0
 */
public final class ReentrantCallException extends ProxyException {

    public ReentrantCallException(final String operation) {
        super("reentrant call to " + operation);
    }
}
