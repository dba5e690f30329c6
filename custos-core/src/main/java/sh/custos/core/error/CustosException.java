// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.error;

/**
 * Base runtime exception for all Custos failures.
 *
 * <p>
 * Every Custos-specific error can be caught with a single catch clause, while
 * the sealed hierarchy keeps the top level exhaustive.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * CustosException
 * ├── {@link AbiDecodingException} - ABI decoding failures
 * ├── {@link AbiEncodingException} - ABI encoding failures
 * ├── {@link RevertException} - an external call reverted
 * └── {@link ProxyException} - a proxy operation was rejected
 * </pre>
 *
 * <pre>{@code
 * try {
 *     proxy.withdraw(client, target, payload, vault, shares);
 * } catch (UnauthorizedCallerException e) {
 *     // wrong caller
 * } catch (RevertException e) {
 *     // the yield protocol rejected the call
 * } catch (CustosException e) {
 *     // anything else
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class CustosException extends RuntimeException
        permits AbiDecodingException,
        AbiEncodingException,
        RevertException,
        ProxyException {

    public CustosException(final String message) {
        super(message);
    }

    public CustosException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
