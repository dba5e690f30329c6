// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import sh.custos.core.types.Address;

/**
 * The factory that created the proxy. It owns the allow-list and the operator registry.
 *
 * @since 0.1.0
 */
public interface ProxyFactory extends AllowListChecker {

    Address address();

    /**
     * Authorizes a reward claim by someone other than the client.
     *
     * @param caller      the account claiming
     * @param client      the proxy's client
     * @param distributor the reward distributor claimed from
     * @throws sh.custos.proxy.error.UnauthorizedCallerException if {@code caller} may not claim
     */
    void checkRewardClaimer(Address caller, Address client, Address distributor);
}
