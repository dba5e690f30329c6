// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.binding;

import java.util.List;
import java.util.Objects;

import sh.custos.core.abi.AbiDecoder;
import sh.custos.core.abi.AbiEncoder;
import sh.custos.core.abi.AddressType;
import sh.custos.core.abi.TypeSchema;
import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;
import sh.custos.core.types.Selector;
import sh.custos.proxy.spi.ContractCaller;
import sh.custos.proxy.spi.Erc4626Vault;

/**
 * {@link Erc4626Vault} over raw contract calls.
 *
 * @since 0.1.0
 */
public final class AbiErc4626Vault implements Erc4626Vault {

    static final Selector ASSET = Selector.of("asset()");

    private final ContractCaller caller;
    private final Address vault;

    public AbiErc4626Vault(final ContractCaller caller, final Address vault) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.vault = Objects.requireNonNull(vault, "vault");
    }

    @Override
    public Address address() {
        return vault;
    }

    @Override
    public Address asset() {
        HexData result = caller.call(Address.ZERO, vault, AbiEncoder.encodeFunction(ASSET, List.of()));
        return ((AddressType) AbiDecoder.decodeSingle(result.toBytes(), new TypeSchema.AddressSchema())).value();
    }
}
