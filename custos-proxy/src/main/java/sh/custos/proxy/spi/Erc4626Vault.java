// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import sh.custos.core.types.Address;

/**
 * A tokenized vault. Its shares are an ERC-20 token at {@link #address()}.
 *
 * @since 0.1.0
 */
public interface Erc4626Vault {

    Address address();

    /**
     * @return the underlying asset the vault's shares redeem into
     */
    Address asset();
}
