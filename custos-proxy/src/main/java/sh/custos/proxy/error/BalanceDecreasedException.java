// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import java.math.BigInteger;

import sh.custos.core.error.ProxyException;
import sh.custos.core.types.Address;

/**
 * Thrown when the proxy's balance of the withdrawn asset fell during the forwarded call.
 *
 * @since 0.1.0
 */
public final class BalanceDecreasedException extends ProxyException {

    private final Address asset;
    private final BigInteger before;
    private final BigInteger after;

    public BalanceDecreasedException(final Address asset, final BigInteger before, final BigInteger after) {
        super("balance of " + asset + " decreased from " + before + " to " + after);
        this.asset = asset;
        this.before = before;
        this.after = after;
    }

    public Address asset() {
        return asset;
    }

    public BigInteger before() {
        return before;
    }

    public BigInteger after() {
        return after;
    }
}
