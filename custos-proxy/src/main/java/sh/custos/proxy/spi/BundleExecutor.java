// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import java.math.BigInteger;
import java.util.List;

import sh.custos.core.types.Address;
import sh.custos.core.types.Hash;
import sh.custos.core.types.HexData;

/**
 * Runs bundles of sub-instructions atomically.
 *
 * @since 0.1.0
 */
public interface BundleExecutor {

    Address address();

    /**
     * Builds the instruction claiming {@code amount} of {@code reward} from a
     * merkle distributor on behalf of {@code account}.
     */
    HexData claimRewardInstruction(
            Address distributor, Address account, Address reward, BigInteger amount, List<Hash> proof);

    /**
     * Executes {@code bundle} in order, called by {@code sender}.
     *
     * @return the executor's raw return data
     */
    HexData multicall(Address sender, List<HexData> bundle);
}
