// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import java.math.BigInteger;

import sh.custos.core.types.Address;

/**
 * The ERC-20 operations the proxy performs on assets, vault shares and reward tokens.
 *
 * @since 0.1.0
 */
public interface Erc20Token {

    Address address();

    BigInteger balanceOf(Address holder);

    BigInteger allowance(Address owner, Address spender);

    /**
     * Sets the allowance of {@code spender} over the tokens of {@code owner}, called by {@code owner}.
     */
    void approve(Address owner, Address spender, BigInteger amount);

    /**
     * Moves {@code amount} from {@code from} to {@code to}, called by {@code from}.
     */
    void transfer(Address from, Address to, BigInteger amount);
}
