// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Division of an amount between the treasury and the client.
 *
 * @param feeAmount    amount sent to the treasury
 * @param clientAmount amount sent to the client
 * @since 0.1.0
 */
public record FeeSplit(BigInteger feeAmount, BigInteger clientAmount) {

    public FeeSplit {
        Objects.requireNonNull(feeAmount, "feeAmount");
        Objects.requireNonNull(clientAmount, "clientAmount");
        if (feeAmount.signum() < 0 || clientAmount.signum() < 0) {
            throw new IllegalArgumentException("split amounts must not be negative");
        }
    }

    public BigInteger total() {
        return feeAmount.add(clientAmount);
    }
}
