// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;
import static sh.custos.proxy.support.ProxyFixture.ASSET;
import static sh.custos.proxy.support.ProxyFixture.CLIENT;
import static sh.custos.proxy.support.ProxyFixture.DISTRIBUTOR;
import static sh.custos.proxy.support.ProxyFixture.FACTORY;
import static sh.custos.proxy.support.ProxyFixture.PROXY;
import static sh.custos.proxy.support.ProxyFixture.REWARD;
import static sh.custos.proxy.support.ProxyFixture.TREASURY;
import static sh.custos.proxy.support.ProxyFixture.VAULT;
import static sh.custos.proxy.support.ProxyFixture.permit;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.custos.core.error.RevertException;
import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;
import sh.custos.proxy.error.ReentrantCallException;
import sh.custos.proxy.event.ProxyEvent;
import sh.custos.proxy.spi.ProxyFactory;
import sh.custos.proxy.support.ProxyFixture;
import sh.custos.proxy.support.ToyVault;

/**
 * Nested calls back into the proxy and rollback of failed operations.
 */
@ExtendWith(MockitoExtension.class)
class YieldProxyReentrancyTest {

    private static final BigInteger PRINCIPAL = BigInteger.valueOf(10_000_000);
    private static final Address ECHO = new Address("0x000000000000000000000000000000000000ec40");
    private static final HexData PING = new HexData("0x5c36b186");

    @Mock
    private ProxyFactory factory;

    private ProxyFixture fixture;
    private YieldProxy proxy;

    @BeforeEach
    void setUp() {
        when(factory.address()).thenReturn(FACTORY);
        fixture = new ProxyFixture(factory);
        proxy = fixture.proxy;
        fixture.chain.deploy(ECHO, (sender, payload) -> payload);
        fixture.initializeAndDeposit(8_700, PRINCIPAL);
    }

    private HexData redeemAll() {
        return ToyVault.redeemCall(PRINCIPAL, PROXY, PROXY);
    }

    private void assertUntouchedSinceDeposit() {
        assertEquals(PRINCIPAL, proxy.totalDeposited(ASSET));
        assertEquals(BigInteger.ZERO, proxy.totalWithdrawn(ASSET));
        assertEquals(PRINCIPAL, fixture.chain.balanceOf(VAULT, PROXY));
        assertEquals(PRINCIPAL, fixture.chain.balanceOf(ASSET, VAULT));
        assertEquals(BigInteger.ZERO, fixture.chain.balanceOf(ASSET, CLIENT));
        assertEquals(BigInteger.ZERO, fixture.chain.balanceOf(ASSET, TREASURY));
        assertEquals(BigInteger.ZERO, fixture.chain.allowance(VAULT, PROXY, VAULT));
        assertEquals(2, proxy.events().size());
    }

    @Test
    void withdrawCannotReenterWithdraw() {
        fixture.vault.duringCall(() -> proxy.withdraw(CLIENT, VAULT, redeemAll(), VAULT, PRINCIPAL));

        ReentrantCallException e = assertThrows(ReentrantCallException.class,
                () -> proxy.withdraw(CLIENT, VAULT, redeemAll(), VAULT, PRINCIPAL));

        assertTrue(e.getMessage().contains("withdraw"));
        assertUntouchedSinceDeposit();
    }

    @Test
    void withdrawCannotReenterCallAnyFunction() {
        fixture.vault.duringCall(() -> proxy.callAnyFunction(CLIENT, ECHO, PING));

        assertThrows(ReentrantCallException.class,
                () -> proxy.withdraw(CLIENT, VAULT, redeemAll(), VAULT, PRINCIPAL));

        assertUntouchedSinceDeposit();
    }

    @Test
    void withdrawCannotReenterClaimReward() {
        fixture.executor.setClaimable(REWARD, BigInteger.valueOf(1_000));
        fixture.vault.duringCall(() -> proxy.claimReward(CLIENT, DISTRIBUTOR, REWARD, BigInteger.valueOf(1_000),
                List.of()));

        assertThrows(ReentrantCallException.class,
                () -> proxy.withdraw(CLIENT, VAULT, redeemAll(), VAULT, PRINCIPAL));

        assertUntouchedSinceDeposit();
        assertEquals(BigInteger.ZERO, fixture.chain.balanceOf(REWARD, CLIENT));
    }

    @Test
    void callAnyFunctionCannotReenterWithdraw() {
        Address hook = new Address("0x0000000000000000000000000000000000000f0c");
        fixture.chain.deploy(hook, (sender, payload) -> {
            proxy.withdraw(CLIENT, VAULT, redeemAll(), VAULT, PRINCIPAL);
            return HexData.EMPTY;
        });

        ReentrantCallException e = assertThrows(ReentrantCallException.class,
                () -> proxy.callAnyFunction(CLIENT, hook, PING));

        assertTrue(e.getMessage().contains("withdraw"));
        assertUntouchedSinceDeposit();
    }

    @Test
    void claimCannotReenterWithdraw() {
        fixture.executor.setClaimable(REWARD, BigInteger.valueOf(1_000));
        fixture.executor.onMulticall(() -> proxy.withdraw(CLIENT, VAULT, redeemAll(), VAULT, PRINCIPAL));

        assertThrows(ReentrantCallException.class, () -> proxy.claimReward(CLIENT, DISTRIBUTOR, REWARD,
                BigInteger.valueOf(1_000), List.of()));

        assertUntouchedSinceDeposit();
        assertEquals(BigInteger.ZERO, fixture.chain.balanceOf(REWARD, PROXY));
    }

    @Test
    void guardIsReleasedAfterRejectedReentry() {
        fixture.vault.duringCall(() -> proxy.callAnyFunction(CLIENT, ECHO, PING));
        assertThrows(ReentrantCallException.class,
                () -> proxy.withdraw(CLIENT, VAULT, redeemAll(), VAULT, PRINCIPAL));

        fixture.vault.duringCall(() -> { });
        WithdrawalSplit split = proxy.withdraw(CLIENT, VAULT, redeemAll(), VAULT, PRINCIPAL);

        assertEquals(PRINCIPAL, split.releasedAmount());
        assertEquals(PRINCIPAL, fixture.chain.balanceOf(ASSET, CLIENT));
    }

    @Test
    void depositAllowsNestedGuardedCall() {
        List<ProxyEvent> received = new ArrayList<>();
        proxy.addListener(received::add);
        BigInteger amount = BigInteger.valueOf(500);
        fixture.chain.mint(ASSET, CLIENT, amount);
        fixture.vault.duringCall(() -> {
            proxy.callAnyFunction(CLIENT, ECHO, PING);
            assertTrue(received.isEmpty());
        });

        proxy.deposit(FACTORY, VAULT, ToyVault.depositCall(amount, PROXY), permit(ASSET, amount));

        assertEquals(List.of(
                new ProxyEvent.CalledAsAnyFunction(ECHO),
                new ProxyEvent.Deposited(VAULT, ASSET, amount, PRINCIPAL.add(amount))), received);
        assertEquals(4, proxy.events().size());
    }

    @Test
    void revertingTargetRollsBackEverything() {
        List<ProxyEvent> received = new ArrayList<>();
        proxy.addListener(received::add);
        int restoresBefore = fixture.chain.restoreCount();
        Address broken = new Address("0x000000000000000000000000000000000000dead");
        fixture.chain.deploy(broken, (sender, payload) -> {
            fixture.chain.move(VAULT, PROXY, broken, PRINCIPAL);
            throw new RevertException(broken, "boom", HexData.EMPTY);
        });

        RevertException e = assertThrows(RevertException.class,
                () -> proxy.withdraw(CLIENT, broken, PING, VAULT, PRINCIPAL));

        assertEquals("boom", e.revertReason());
        assertUntouchedSinceDeposit();
        assertTrue(received.isEmpty());
        assertTrue(fixture.chain.restoreCount() > restoresBefore);
    }
}
