// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Result of splitting one withdrawal against the ledger totals.
 *
 * @param releasedAmount  amount the withdrawal released to the proxy
 * @param withdrawnAfter  cumulative withdrawn total once this withdrawal is recorded
 * @param newProfit       profit realized by this withdrawal alone
 * @param split           treasury and client shares of {@code releasedAmount}
 * @since 0.1.0
 */
public record WithdrawalSplit(
        BigInteger releasedAmount,
        BigInteger withdrawnAfter,
        BigInteger newProfit,
        FeeSplit split) {

    public WithdrawalSplit {
        Objects.requireNonNull(releasedAmount, "releasedAmount");
        Objects.requireNonNull(withdrawnAfter, "withdrawnAfter");
        Objects.requireNonNull(newProfit, "newProfit");
        Objects.requireNonNull(split, "split");
    }

    public BigInteger feeAmount() {
        return split.feeAmount();
    }

    public BigInteger clientAmount() {
        return split.clientAmount();
    }
}
