// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import java.math.BigInteger;

import sh.custos.core.types.Address;

/**
 * Signature-based token movement: pulls tokens from a holder without a prior
 * on-chain approval to the puller.
 *
 * @since 0.1.0
 */
public interface PermitTransfer {

    Address address();

    /**
     * Registers {@code authorization}, signed by {@code owner}, submitted by its spender.
     */
    void permit(Address owner, PermitAuthorization authorization);

    /**
     * Moves {@code amount} of {@code token} from {@code from} to {@code to} under a
     * previously registered permit, called by {@code spender}.
     */
    void transferFrom(Address spender, Address from, Address to, BigInteger amount, Address token);
}
