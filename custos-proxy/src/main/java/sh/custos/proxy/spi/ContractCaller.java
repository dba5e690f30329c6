// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;

/**
 * Executes one external call.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ContractCaller {

    /**
     * Calls {@code target} with {@code payload} on behalf of {@code sender}.
     *
     * @param sender  the calling account
     * @param target  the called contract
     * @param payload the calldata
     * @return the call's return data
     * @throws sh.custos.core.error.RevertException if the call reverts
     */
    HexData call(Address sender, Address target, HexData payload);
}
