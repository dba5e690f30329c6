// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;

/**
 * Thrown when a fee rate lies outside {@code (0, 10000]} basis points.
 *
 * @since 0.1.0
 */
public final class InvalidFeeRateException extends ProxyException {

    private final long basisPoints;

    public InvalidFeeRateException(final long basisPoints) {
        super("fee rate must be in (0, 10000] basis points, got " + basisPoints);
        this.basisPoints = basisPoints;
    }

    public long basisPoints() {
        return basisPoints;
    }
}
