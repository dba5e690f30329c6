// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.support;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import sh.custos.core.crypto.PrivateKey;
import sh.custos.core.types.Address;
import sh.custos.core.types.Hash;
import sh.custos.core.types.HexData;
import sh.custos.proxy.ProxyConfig;
import sh.custos.proxy.YieldProxy;
import sh.custos.proxy.spi.PermitAuthorization;
import sh.custos.proxy.spi.ProxyFactory;

/**
 * A proxy wired to an in-memory chain holding one asset and one vault.
 */
public final class ProxyFixture {

    public static final PrivateKey CLIENT_KEY =
            PrivateKey.fromHex("0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318");
    public static final Address CLIENT = CLIENT_KEY.toAddress();
    public static final Hash PERMIT_HASH = Hash.keccak("permit".getBytes(StandardCharsets.UTF_8));
    /** {@link #CLIENT_KEY} over {@link #PERMIT_HASH}, low-s with v = 27. */
    public static final HexData CLIENT_PERMIT_SIGNATURE = new HexData("0x"
            + "4ff81a6e6e6847c16f673d2afc54e9d546f722d002e5d03b1f9200e91cd601ed"
            + "679aa49db36371fc710bb8ad0accd3c636bc2009d4a8a9381701d5c8b0751e74"
            + "1b");
    /** The key {@code 0x0101..01} over {@link #PERMIT_HASH}. */
    public static final HexData OTHER_PERMIT_SIGNATURE = new HexData("0x"
            + "b54ef5e320a86d278e28e60a92951ed69860c65b7b1db8595c69f8fe0e91b2a6"
            + "615f3a62d94af2d2fb725d7d707da9df3348cbef72bb2c2d320a19a7d1ee9685"
            + "1c");
    public static final Address FACTORY = new Address("0x00000000000000000000000000000000000fac70");
    public static final Address TREASURY = new Address("0x0000000000000000000000000000000000007ea5");
    public static final Address EXECUTOR = new Address("0x000000000000000000000000000000000000b0d1");
    public static final Address PROXY = new Address("0x000000000000000000000000000000000000c0de");
    public static final Address PERMIT2 = new Address("0x000000000022d473030f116ddee9f6b43ac78ba3");
    public static final Address ASSET = new Address("0x000000000000000000000000000000000000a55e");
    public static final Address VAULT = new Address("0x0000000000000000000000000000000000007a17");
    public static final Address REWARD = new Address("0x000000000000000000000000000000000000f00d");
    public static final Address DISTRIBUTOR = new Address("0x0000000000000000000000000000000000d15700");
    public static final Address OPERATOR = new Address("0x00000000000000000000000000000000000000e0");
    public static final Address STRANGER = new Address("0x0000000000000000000000000000000000000bad");

    public final InMemoryChain chain = new InMemoryChain();
    public final StubPermit2 permit2 = new StubPermit2(chain, PERMIT2);
    public final StubBundleExecutor executor = new StubBundleExecutor(chain, EXECUTOR);
    public final ToyVault vault = new ToyVault(chain, VAULT, ASSET);
    public final YieldProxy proxy;

    public ProxyFixture(final ProxyFactory factory) {
        ProxyConfig config = ProxyConfig.builder()
                .proxyAddress(PROXY)
                .executor(EXECUTOR)
                .factory(FACTORY)
                .treasury(TREASURY)
                .build();
        this.proxy = YieldProxy.builder()
                .config(config)
                .factory(factory)
                .executor(executor)
                .permitTransfer(permit2)
                .environment(chain)
                .build();
    }

    public static PermitAuthorization permit(final Address token, final BigInteger amount) {
        return new PermitAuthorization(token, amount, 1_800_000_000L, 0, PROXY,
                BigInteger.valueOf(1_800_000_000L), new HexData("0x" + "11".repeat(65)));
    }

    /**
     * Initializes the proxy for {@link #CLIENT} and deposits {@code amount} of {@link #ASSET}
     * into the vault, leaving the proxy holding the same number of vault shares.
     */
    public void initializeAndDeposit(final long feeBps, final BigInteger amount) {
        proxy.initialize(FACTORY, CLIENT, feeBps);
        chain.mint(ASSET, CLIENT, amount);
        proxy.deposit(FACTORY, VAULT, ToyVault.depositCall(amount, PROXY), permit(ASSET, amount));
    }

    /**
     * Redeems {@code shares} through the vault, which pays out {@code released} of the asset.
     */
    public void withdraw(final BigInteger shares, final BigInteger released) {
        BigInteger vaultAssets = chain.balanceOf(ASSET, VAULT);
        if (vaultAssets.compareTo(released) < 0) {
            chain.mint(ASSET, VAULT, released.subtract(vaultAssets));
        }
        vault.nextRedemption(released);
        proxy.withdraw(CLIENT, VAULT, ToyVault.redeemCall(shares, PROXY, PROXY), VAULT, shares);
    }
}
