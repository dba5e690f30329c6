// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.util.Objects;

import sh.custos.core.types.Address;
import sh.custos.proxy.error.UnauthorizedCallerException;

/**
 * Role predicates for proxy operations.
 *
 * @since 0.1.0
 */
public final class AccessController {

    private final Address factory;
    private final ProxyLedger ledger;

    public AccessController(final Address factory, final ProxyLedger ledger) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    /**
     * @throws UnauthorizedCallerException if {@code caller} is not the factory
     */
    public void requireFactory(final Address caller) {
        require(caller, factory, Role.FACTORY);
    }

    /**
     * Before initialization the client is the zero address and no caller passes.
     *
     * @throws UnauthorizedCallerException if {@code caller} is not the client
     */
    public void requireClient(final Address caller) {
        Address client = ledger.client();
        if (client.isZero()) {
            throw new UnauthorizedCallerException(caller, client, Role.CLIENT);
        }
        require(caller, client, Role.CLIENT);
    }

    public boolean isClient(final Address caller) {
        Address client = ledger.client();
        return !client.isZero() && client.equals(caller);
    }

    private static void require(final Address caller, final Address expected, final Role role) {
        Objects.requireNonNull(caller, "caller");
        if (!expected.equals(caller)) {
            throw new UnauthorizedCallerException(caller, expected, role);
        }
    }
}
