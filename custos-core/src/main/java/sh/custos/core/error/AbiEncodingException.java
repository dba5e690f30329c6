// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.error;

/**
 * Thrown when a value cannot be ABI-encoded, e.g. it overflows its declared width.
 *
 * @since 0.1.0
 */
public final class AbiEncodingException extends CustosException {

    public AbiEncodingException(final String message) {
        super(message);
    }

    public AbiEncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
