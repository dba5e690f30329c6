// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;

/**
 * Thrown when a payload is too short to carry a function selector.
 *
 * @since 0.1.0
 */
public final class MalformedCalldataException extends ProxyException {

    public MalformedCalldataException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
