// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.error;

/**
 * Base class for rejected proxy operations.
 * <p>
 * Non-sealed so the proxy module can define one subclass per error kind
 * (authorization, validation, external outcome) while callers can still catch
 * the whole family at once.
 *
 * @since 0.1.0
 */
public non-sealed class ProxyException extends CustosException {

    public ProxyException(final String message) {
        super(message);
    }

    public ProxyException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
