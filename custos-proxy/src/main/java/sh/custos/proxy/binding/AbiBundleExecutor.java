// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.binding;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import sh.custos.core.abi.AbiEncoder;
import sh.custos.core.abi.AbiType;
import sh.custos.core.abi.AddressType;
import sh.custos.core.abi.Array;
import sh.custos.core.abi.Bool;
import sh.custos.core.abi.Bytes;
import sh.custos.core.abi.UInt;
import sh.custos.core.types.Address;
import sh.custos.core.types.Hash;
import sh.custos.core.types.HexData;
import sh.custos.core.types.Selector;
import sh.custos.proxy.spi.BundleExecutor;
import sh.custos.proxy.spi.ContractCaller;

/**
 * {@link BundleExecutor} for a Morpho-style bundler exposing {@code multicall(bytes[])}
 * and the {@code urdClaim} action.
 *
 * @since 0.1.0
 */
public final class AbiBundleExecutor implements BundleExecutor {

    static final Selector URD_CLAIM = Selector.of("urdClaim(address,address,address,uint256,bytes32[],bool)");
    static final Selector MULTICALL = Selector.of("multicall(bytes[])");

    private final ContractCaller caller;
    private final Address executor;

    public AbiBundleExecutor(final ContractCaller caller, final Address executor) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public Address address() {
        return executor;
    }

    /**
     * Encodes {@code urdClaim} with {@code skipRevert = false}, so a failing claim
     * reverts the whole bundle.
     */
    @Override
    public HexData claimRewardInstruction(
            final Address distributor,
            final Address account,
            final Address reward,
            final BigInteger amount,
            final List<Hash> proof) {
        List<Bytes> proofWords = proof.stream()
                .map(hash -> Bytes.fixed(hash.toBytes()))
                .toList();
        List<AbiType> args = List.of(
                new AddressType(distributor),
                new AddressType(account),
                new AddressType(reward),
                UInt.uint256(amount),
                Array.dynamic(proofWords, "bytes32"),
                new Bool(false));
        return AbiEncoder.encodeFunction(URD_CLAIM, args);
    }

    @Override
    public HexData multicall(final Address sender, final List<HexData> bundle) {
        List<Bytes> calls = bundle.stream().map(Bytes::dynamic).toList();
        HexData payload = AbiEncoder.encodeFunction(MULTICALL, List.of(Array.dynamic(calls, "bytes")));
        return caller.call(sender, executor, payload);
    }
}
