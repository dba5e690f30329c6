// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import sh.custos.core.types.Address;
import sh.custos.proxy.Journaled;

/**
 * The chain the proxy operates on: raw calls plus typed views of tokens and vaults.
 *
 * <p>
 * As a {@link Journaled} participant the environment is checkpointed with the
 * proxy state, so a failed operation also undoes its balance movements where the
 * environment is able to.
 *
 * @since 0.1.0
 */
public interface ChainEnvironment extends ContractCaller, Journaled {

    Erc20Token token(Address token);

    Erc4626Vault vault(Address vault);
}
