// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import sh.custos.core.types.Address;
import sh.custos.proxy.error.UnauthorizedCallerException;

class AccessControllerTest {

    private static final Address FACTORY = new Address("0x00000000000000000000000000000000000fac70");
    private static final Address CLIENT = new Address("0x00000000000000000000000000000000000000c1");
    private static final Address OTHER = new Address("0x0000000000000000000000000000000000000bad");

    private final ProxyLedger ledger = new ProxyLedger();
    private final AccessController access = new AccessController(FACTORY, ledger);

    @Test
    void factoryGate() {
        assertDoesNotThrow(() -> access.requireFactory(FACTORY));

        UnauthorizedCallerException e = assertThrows(UnauthorizedCallerException.class,
                () -> access.requireFactory(OTHER));
        assertEquals(OTHER, e.actual());
        assertEquals(FACTORY, e.expected());
        assertEquals(Role.FACTORY, e.role());
    }

    @Test
    void clientGateFailsForEveryoneBeforeInitialization() {
        UnauthorizedCallerException e = assertThrows(UnauthorizedCallerException.class,
                () -> access.requireClient(Address.ZERO));
        assertEquals(Address.ZERO, e.expected());
        assertEquals(Role.CLIENT, e.role());
        assertFalse(access.isClient(Address.ZERO));
    }

    @Test
    void clientGateAfterInitialization() {
        ledger.initialize(CLIENT, new FeeRate(9_000));

        assertDoesNotThrow(() -> access.requireClient(CLIENT));
        assertTrue(access.isClient(CLIENT));
        assertThrows(UnauthorizedCallerException.class, () -> access.requireClient(FACTORY));
    }

    @Test
    void messageNamesBothAddresses() {
        UnauthorizedCallerException e = assertThrows(UnauthorizedCallerException.class,
                () -> access.requireFactory(OTHER));
        assertTrue(e.getMessage().contains(OTHER.value()));
        assertTrue(e.getMessage().contains(FACTORY.value()));
        assertTrue(e.getMessage().contains("factory"));
    }
}
