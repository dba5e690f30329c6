// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.custos.core.types.Address;
import sh.custos.proxy.error.AlreadyInitializedException;
import sh.custos.proxy.error.NotInitializedException;
import sh.custos.proxy.error.ZeroAddressException;

/**
 * Authoritative mutable state of a proxy: cumulative per-asset totals and the
 * once-written client identity and fee rate.
 *
 * <p>
 * Totals only grow. Assets never touched read as zero.
 *
 * @since 0.1.0
 */
public final class ProxyLedger implements Journaled {

    private final Map<Address, BigInteger> deposited = new HashMap<>();
    private final Map<Address, BigInteger> withdrawn = new HashMap<>();
    private Address client = Address.ZERO;
    private @Nullable FeeRate feeRate;

    /**
     * Sets the client and fee rate.
     *
     * @throws ZeroAddressException         if {@code client} is the zero address
     * @throws AlreadyInitializedException  if the ledger was already initialized
     */
    public void initialize(final Address client, final FeeRate feeRate) {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(feeRate, "feeRate");
        if (this.feeRate != null) {
            throw new AlreadyInitializedException(this.client);
        }
        if (client.isZero()) {
            throw new ZeroAddressException("client");
        }
        this.client = client;
        this.feeRate = feeRate;
    }

    public ProxyState state() {
        return feeRate == null ? ProxyState.UNINITIALIZED : ProxyState.ACTIVE;
    }

    /**
     * @return the client, or the zero address before initialization
     */
    public Address client() {
        return client;
    }

    /**
     * @return the fee rate in basis points, or zero before initialization
     */
    public int feeBasisPoints() {
        return feeRate == null ? 0 : feeRate.basisPoints();
    }

    /**
     * @param operation name used in the error message
     * @return the fee rate
     * @throws NotInitializedException before initialization
     */
    public FeeRate requireFeeRate(final String operation) {
        FeeRate rate = feeRate;
        if (rate == null) {
            throw new NotInitializedException(operation);
        }
        return rate;
    }

    public BigInteger deposited(final Address asset) {
        return deposited.getOrDefault(asset, BigInteger.ZERO);
    }

    public BigInteger withdrawn(final Address asset) {
        return withdrawn.getOrDefault(asset, BigInteger.ZERO);
    }

    /**
     * Adds {@code amount} to the deposited total of {@code asset}.
     *
     * @return the new total
     */
    public BigInteger recordDeposit(final Address asset, final BigInteger amount) {
        return add(deposited, asset, amount);
    }

    /**
     * Adds {@code amount} to the withdrawn total of {@code asset}.
     *
     * @return the new total
     */
    public BigInteger recordWithdrawal(final Address asset, final BigInteger amount) {
        return add(withdrawn, asset, amount);
    }

    private static BigInteger add(final Map<Address, BigInteger> totals, final Address asset, final BigInteger amount) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount);
        }
        return totals.merge(asset, amount, BigInteger::add);
    }

    @Override
    public Checkpoint checkpoint() {
        final Map<Address, BigInteger> savedDeposited = Map.copyOf(deposited);
        final Map<Address, BigInteger> savedWithdrawn = Map.copyOf(withdrawn);
        final Address savedClient = client;
        final FeeRate savedFeeRate = feeRate;
        return () -> {
            deposited.clear();
            deposited.putAll(savedDeposited);
            withdrawn.clear();
            withdrawn.putAll(savedWithdrawn);
            client = savedClient;
            feeRate = savedFeeRate;
        };
    }
}
