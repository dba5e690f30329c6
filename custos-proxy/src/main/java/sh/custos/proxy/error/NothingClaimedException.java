// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;
import sh.custos.core.types.Address;

/**
 * Thrown when a reward claim did not increase the proxy's reward token balance.
 *
 * @since 0.1.0
 */
public final class NothingClaimedException extends ProxyException {

    private final Address reward;

    public NothingClaimedException(final Address reward) {
        super("nothing claimed for reward token " + reward);
        this.reward = reward;
    }

    public Address reward() {
        return reward;
    }
}
