// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.event;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import sh.custos.core.types.Address;

/**
 * Audit record of a state-changing proxy operation.
 *
 * <p>
 * Serialized to JSON with a {@code "type"} discriminator, e.g.
 * <pre>{@code
 * {"type":"Deposited","target":"0x..","asset":"0x..","amount":1000,"newTotalDeposited":1000}
 * }</pre>
 *
 * @since 0.1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
public sealed interface ProxyEvent {

    @JsonTypeName("Initialized")
    record Initialized(Address client, int feeBps) implements ProxyEvent {
        public Initialized {
            Objects.requireNonNull(client, "client");
        }
    }

    @JsonTypeName("Deposited")
    record Deposited(Address target, Address asset, BigInteger amount, BigInteger newTotalDeposited)
            implements ProxyEvent {
        public Deposited {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(asset, "asset");
            Objects.requireNonNull(amount, "amount");
            Objects.requireNonNull(newTotalDeposited, "newTotalDeposited");
        }
    }

    @JsonTypeName("Withdrawn")
    record Withdrawn(
            Address target,
            Address vault,
            Address asset,
            BigInteger shares,
            BigInteger releasedAmount,
            BigInteger newTotalWithdrawn,
            BigInteger newProfit,
            BigInteger feeAmount,
            BigInteger clientAmount) implements ProxyEvent {
        public Withdrawn {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(vault, "vault");
            Objects.requireNonNull(asset, "asset");
            Objects.requireNonNull(shares, "shares");
            Objects.requireNonNull(releasedAmount, "releasedAmount");
            Objects.requireNonNull(newTotalWithdrawn, "newTotalWithdrawn");
            Objects.requireNonNull(newProfit, "newProfit");
            Objects.requireNonNull(feeAmount, "feeAmount");
            Objects.requireNonNull(clientAmount, "clientAmount");
        }
    }

    @JsonTypeName("CalledAsAnyFunction")
    record CalledAsAnyFunction(Address target) implements ProxyEvent {
        public CalledAsAnyFunction {
            Objects.requireNonNull(target, "target");
        }
    }

    @JsonTypeName("ClaimedReward")
    record ClaimedReward(
            Address distributor,
            Address reward,
            BigInteger claimedAmount,
            BigInteger feeAmount,
            BigInteger clientAmount) implements ProxyEvent {
        public ClaimedReward {
            Objects.requireNonNull(distributor, "distributor");
            Objects.requireNonNull(reward, "reward");
            Objects.requireNonNull(claimedAmount, "claimedAmount");
            Objects.requireNonNull(feeAmount, "feeAmount");
            Objects.requireNonNull(clientAmount, "clientAmount");
        }
    }
}
