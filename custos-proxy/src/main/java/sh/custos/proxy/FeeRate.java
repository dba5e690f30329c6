// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.math.BigInteger;
import java.util.Objects;

import sh.custos.proxy.error.InvalidFeeRateException;

/**
 * The client's share of realized profit, in basis points.
 *
 * <p>
 * The treasury receives the complementary {@code MAX_BASIS_POINTS - basisPoints}.
 * A rate of 10000 leaves the whole profit to the client.
 *
 * @param basisPoints client share in {@code (0, 10000]}
 * @since 0.1.0
 */
public record FeeRate(int basisPoints) {

    public static final int MAX_BASIS_POINTS = 10_000;

    private static final BigInteger DENOMINATOR = BigInteger.valueOf(MAX_BASIS_POINTS);

    public FeeRate {
        if (basisPoints <= 0 || basisPoints > MAX_BASIS_POINTS) {
            throw new InvalidFeeRateException(basisPoints);
        }
    }

    /**
     * Validates a rate given as a wide integer, as received from an encoded call.
     *
     * @param basisPoints the requested rate
     * @return the fee rate
     * @throws InvalidFeeRateException if the value is outside {@code (0, 10000]}
     */
    public static FeeRate of(final long basisPoints) {
        if (basisPoints <= 0 || basisPoints > MAX_BASIS_POINTS) {
            throw new InvalidFeeRateException(basisPoints);
        }
        return new FeeRate((int) basisPoints);
    }

    /**
     * @return the treasury's share in basis points
     */
    public int treasuryBasisPoints() {
        return MAX_BASIS_POINTS - basisPoints;
    }

    /**
     * Computes {@code floor(amount * (10000 - basisPoints) / 10000)}.
     *
     * @param amount a non-negative amount
     * @return the treasury's share of {@code amount}
     */
    public BigInteger treasuryShareOf(final BigInteger amount) {
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount);
        }
        return amount.multiply(BigInteger.valueOf(treasuryBasisPoints())).divide(DENOMINATOR);
    }
}
