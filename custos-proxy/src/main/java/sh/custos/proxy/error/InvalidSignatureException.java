// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;
import sh.custos.core.types.Hash;

/**
 * Thrown when a signature presented to the proxy was not produced by its client.
 *
 * @since 0.1.0
 */
public final class InvalidSignatureException extends ProxyException {

    public InvalidSignatureException(final Hash hash) {
        super("signature over " + hash + " was not produced by the client");
    }
}
