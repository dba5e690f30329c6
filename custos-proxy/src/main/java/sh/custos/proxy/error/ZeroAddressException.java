// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;

/**
 * Thrown when an address argument that must identify an account or asset is the zero address.
 *
 * @since 0.1.0
 */
public final class ZeroAddressException extends ProxyException {

    private final String field;

    public ZeroAddressException(final String field) {
        super(field + " must not be the zero address");
        this.field = field;
    }

    public String field() {
        return field;
    }
}
