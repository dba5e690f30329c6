// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.binding;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import sh.custos.core.abi.AbiDecoder;
import sh.custos.core.abi.AbiEncoder;
import sh.custos.core.abi.AddressType;
import sh.custos.core.abi.Bool;
import sh.custos.core.abi.TypeSchema;
import sh.custos.core.abi.UInt;
import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;
import sh.custos.core.types.Selector;
import sh.custos.proxy.error.TokenCallFailedException;
import sh.custos.proxy.spi.ContractCaller;
import sh.custos.proxy.spi.Erc20Token;

/**
 * {@link Erc20Token} over raw contract calls.
 *
 * <p>
 * Tokens that return nothing from {@code transfer}/{@code approve} are accepted;
 * an explicit {@code false} fails with {@link TokenCallFailedException}.
 *
 * @since 0.1.0
 */
public final class AbiErc20Token implements Erc20Token {

    static final Selector BALANCE_OF = Selector.of("balanceOf(address)");
    static final Selector ALLOWANCE = Selector.of("allowance(address,address)");
    static final Selector APPROVE = Selector.of("approve(address,uint256)");
    static final Selector TRANSFER = Selector.of("transfer(address,uint256)");

    private static final TypeSchema UINT256 = new TypeSchema.UIntSchema(256);

    private final ContractCaller caller;
    private final Address token;

    public AbiErc20Token(final ContractCaller caller, final Address token) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.token = Objects.requireNonNull(token, "token");
    }

    @Override
    public Address address() {
        return token;
    }

    @Override
    public BigInteger balanceOf(final Address holder) {
        HexData result = caller.call(Address.ZERO, token,
                AbiEncoder.encodeFunction(BALANCE_OF, List.of(new AddressType(holder))));
        return ((UInt) AbiDecoder.decodeSingle(result.toBytes(), UINT256)).value();
    }

    @Override
    public BigInteger allowance(final Address owner, final Address spender) {
        HexData result = caller.call(Address.ZERO, token,
                AbiEncoder.encodeFunction(ALLOWANCE, List.of(new AddressType(owner), new AddressType(spender))));
        return ((UInt) AbiDecoder.decodeSingle(result.toBytes(), UINT256)).value();
    }

    @Override
    public void approve(final Address owner, final Address spender, final BigInteger amount) {
        HexData result = caller.call(owner, token,
                AbiEncoder.encodeFunction(APPROVE, List.of(new AddressType(spender), UInt.uint256(amount))));
        requireSuccess(result, "approve");
    }

    @Override
    public void transfer(final Address from, final Address to, final BigInteger amount) {
        HexData result = caller.call(from, token,
                AbiEncoder.encodeFunction(TRANSFER, List.of(new AddressType(to), UInt.uint256(amount))));
        requireSuccess(result, "transfer");
    }

    private void requireSuccess(final HexData result, final String function) {
        if (result.isEmpty()) {
            return;
        }
        Bool success = (Bool) AbiDecoder.decodeSingle(result.toBytes(), new TypeSchema.BoolSchema());
        if (!success.value()) {
            throw new TokenCallFailedException(token, function);
        }
    }
}
