// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.error;

/**
 * Thrown when return data does not match the expected ABI layout.
 *
 * @since 0.1.0
 */
public final class AbiDecodingException extends CustosException {

    public AbiDecodingException(final String message) {
        super(message);
    }

    public AbiDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
