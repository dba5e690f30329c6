// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;
import sh.custos.core.types.Address;

/**
 * Thrown when an ERC-20 {@code transfer} or {@code approve} returns {@code false}.
 *
 * @since 0.1.0
 */
public final class TokenCallFailedException extends ProxyException {

    private final Address token;
    private final String function;

    public TokenCallFailedException(final Address token, final String function) {
        super(function + " on token " + token + " returned false");
        this.token = token;
        this.function = function;
    }

    public Address token() {
        return token;
    }

    public String function() {
        return function;
    }
}
