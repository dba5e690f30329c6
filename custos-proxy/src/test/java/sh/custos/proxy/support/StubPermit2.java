// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.support;

import java.math.BigInteger;

import sh.custos.core.error.RevertException;
import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;
import sh.custos.proxy.spi.PermitAuthorization;
import sh.custos.proxy.spi.PermitTransfer;

/**
 * Permit primitive that records permits as allowances on the in-memory chain.
 * Signatures are not checked.
 */
public final class StubPermit2 implements PermitTransfer {

    private final InMemoryChain chain;
    private final Address address;

    public StubPermit2(final InMemoryChain chain, final Address address) {
        this.chain = chain;
        this.address = address;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public void permit(final Address owner, final PermitAuthorization authorization) {
        if (authorization.signature().isEmpty()) {
            throw new RevertException(address, "missing signature", HexData.EMPTY);
        }
        chain.setAllowance(authorization.token(), owner, authorization.spender(), authorization.amount());
    }

    @Override
    public void transferFrom(
            final Address spender,
            final Address from,
            final Address to,
            final BigInteger amount,
            final Address token) {
        chain.spendAllowance(token, from, spender, amount);
        chain.move(token, from, to, amount);
    }
}
