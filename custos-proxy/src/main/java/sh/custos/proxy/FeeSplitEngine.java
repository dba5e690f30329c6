// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Performance-fee computation.
 *
 * <p>
 * Withdrawals are taxed on the profit they realize: the increase of
 * {@code max(0, withdrawn - deposited)} caused by the withdrawal. Any sequence of
 * partial withdrawals therefore pays the same fee as one withdrawal of the sum,
 * up to one unit of rounding per withdrawal.
 *
 * <p>
 * Reward claims have no principal, so the treasury share is taken on the full
 * claimed amount.
 *
 * <p>
 * The engine is stateless and never touches the ledger.
 *
 * @since 0.1.0
 */
public final class FeeSplitEngine {

    /**
     * Splits a withdrawal of {@code newAmount} given the current ledger totals.
     *
     * @param deposited       cumulative deposited total of the asset
     * @param withdrawnBefore cumulative withdrawn total before this withdrawal
     * @param newAmount       amount released by this withdrawal
     * @param rate            the client's fee rate
     * @return the split, including the withdrawn total to persist
     */
    public WithdrawalSplit splitWithdrawal(
            final BigInteger deposited,
            final BigInteger withdrawnBefore,
            final BigInteger newAmount,
            final FeeRate rate) {
        Objects.requireNonNull(rate, "rate");
        requireNonNegative(deposited, "deposited");
        requireNonNegative(withdrawnBefore, "withdrawnBefore");
        requireNonNegative(newAmount, "newAmount");

        BigInteger withdrawnAfter = withdrawnBefore.add(newAmount);
        BigInteger profitBefore = realizedProfit(deposited, withdrawnBefore);
        BigInteger profitAfter = realizedProfit(deposited, withdrawnAfter);
        BigInteger newProfit = profitAfter.subtract(profitBefore);

        BigInteger feeAmount = rate.treasuryShareOf(newProfit);
        return new WithdrawalSplit(newAmount, withdrawnAfter, newProfit,
                new FeeSplit(feeAmount, newAmount.subtract(feeAmount)));
    }

    /**
     * Splits a reward claim with the flat policy.
     *
     * @param claimedAmount amount the claim added to the proxy's balance
     * @param rate          the client's fee rate
     * @return the split
     */
    public FeeSplit splitClaim(final BigInteger claimedAmount, final FeeRate rate) {
        Objects.requireNonNull(rate, "rate");
        requireNonNegative(claimedAmount, "claimedAmount");
        BigInteger feeAmount = rate.treasuryShareOf(claimedAmount);
        return new FeeSplit(feeAmount, claimedAmount.subtract(feeAmount));
    }

    /**
     * @return {@code max(0, withdrawn - deposited)}
     */
    public static BigInteger realizedProfit(final BigInteger deposited, final BigInteger withdrawn) {
        return withdrawn.subtract(deposited).max(BigInteger.ZERO);
    }

    private static void requireNonNegative(final BigInteger value, final String name) {
        Objects.requireNonNull(value, name);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
