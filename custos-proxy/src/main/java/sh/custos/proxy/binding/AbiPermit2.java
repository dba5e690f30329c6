// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.binding;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import sh.custos.core.abi.AbiEncoder;
import sh.custos.core.abi.AddressType;
import sh.custos.core.abi.Bytes;
import sh.custos.core.abi.Tuple;
import sh.custos.core.abi.UInt;
import sh.custos.core.types.Address;
import sh.custos.core.types.Selector;
import sh.custos.proxy.spi.ContractCaller;
import sh.custos.proxy.spi.PermitAuthorization;
import sh.custos.proxy.spi.PermitTransfer;

/**
 * {@link PermitTransfer} for Uniswap's Permit2 allowance transfer contract.
 *
 * @since 0.1.0
 */
public final class AbiPermit2 implements PermitTransfer {

    static final Selector PERMIT =
            Selector.of("permit(address,((address,uint160,uint48,uint48),address,uint256),bytes)");
    static final Selector TRANSFER_FROM = Selector.of("transferFrom(address,address,uint160,address)");

    private final ContractCaller caller;
    private final Address permit2;

    public AbiPermit2(final ContractCaller caller, final Address permit2) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.permit2 = Objects.requireNonNull(permit2, "permit2");
    }

    @Override
    public Address address() {
        return permit2;
    }

    /**
     * Submits the permit from its spender.
     */
    @Override
    public void permit(final Address owner, final PermitAuthorization authorization) {
        Tuple details = Tuple.of(
                new AddressType(authorization.token()),
                new UInt(160, authorization.amount()),
                new UInt(48, BigInteger.valueOf(authorization.expiration())),
                new UInt(48, BigInteger.valueOf(authorization.nonce())));
        Tuple permitSingle = Tuple.of(
                details,
                new AddressType(authorization.spender()),
                UInt.uint256(authorization.sigDeadline()));
        caller.call(authorization.spender(), permit2, AbiEncoder.encodeFunction(PERMIT, List.of(
                new AddressType(owner), permitSingle, Bytes.dynamic(authorization.signature()))));
    }

    @Override
    public void transferFrom(
            final Address spender,
            final Address from,
            final Address to,
            final BigInteger amount,
            final Address token) {
        caller.call(spender, permit2, AbiEncoder.encodeFunction(TRANSFER_FROM, List.of(
                new AddressType(from), new AddressType(to), new UInt(160, amount), new AddressType(token))));
    }
}
