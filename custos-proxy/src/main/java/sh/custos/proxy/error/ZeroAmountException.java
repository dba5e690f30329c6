// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;

/**
 * Thrown when a deposit amount or a share count is zero.
 *
 * @since 0.1.0
 */
public final class ZeroAmountException extends ProxyException {

    private final String field;

    public ZeroAmountException(final String field) {
        super(field + " must be greater than zero");
        this.field = field;
    }

    public String field() {
        return field;
    }
}
