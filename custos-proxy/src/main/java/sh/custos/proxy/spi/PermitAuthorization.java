// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import java.math.BigInteger;
import java.util.Objects;

import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;

/**
 * A signed single-token permit, in the shape of Permit2's {@code PermitSingle}.
 *
 * @param token       the permitted token
 * @param amount      the permitted amount (uint160)
 * @param expiration  when the allowance expires (uint48)
 * @param nonce       the owner's permit nonce (uint48)
 * @param spender     the account allowed to pull, the proxy
 * @param sigDeadline when the signature stops being valid
 * @param signature   the owner's signature over the permit
 * @since 0.1.0
 */
public record PermitAuthorization(
        Address token,
        BigInteger amount,
        long expiration,
        long nonce,
        Address spender,
        BigInteger sigDeadline,
        HexData signature) {

    private static final int UINT160_BITS = 160;
    private static final long UINT48_MAX = (1L << 48) - 1;

    public PermitAuthorization {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(spender, "spender");
        Objects.requireNonNull(sigDeadline, "sigDeadline");
        Objects.requireNonNull(signature, "signature");
        if (amount.signum() < 0 || amount.bitLength() > UINT160_BITS) {
            throw new IllegalArgumentException("amount must fit in uint160: " + amount);
        }
        if (expiration < 0 || expiration > UINT48_MAX) {
            throw new IllegalArgumentException("expiration must fit in uint48: " + expiration);
        }
        if (nonce < 0 || nonce > UINT48_MAX) {
            throw new IllegalArgumentException("nonce must fit in uint48: " + nonce);
        }
        if (sigDeadline.signum() < 0) {
            throw new IllegalArgumentException("sigDeadline must not be negative");
        }
    }
}
