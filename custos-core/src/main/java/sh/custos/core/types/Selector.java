// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.types;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.custos.core.crypto.Keccak256;
import sh.custos.primitives.Hex;

/**
 * Hex-encoded 4-byte function selector.
 * <p>
 * A selector is the first four bytes of the Keccak-256 hash of a canonical
 * function signature such as {@code transfer(address,uint256)}. It also serves
 * as an ERC-165 interface identifier, which is the XOR of the selectors of an
 * interface's functions.
 *
 * <pre>{@code
 * Selector transfer = Selector.of("transfer(address,uint256)"); // 0xa9059cbb
 * }</pre>
 *
 * @since 0.1.0
 */
public record Selector(@com.fasterxml.jackson.annotation.JsonValue String value) {
    /** Number of bytes in a selector. */
    public static final int BYTE_LENGTH = 4;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public Selector {
        Objects.requireNonNull(value, "selector");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid selector: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Computes the selector of a canonical function signature.
     *
     * @param signature the signature, e.g. {@code "balanceOf(address)"}
     * @return the first four bytes of its Keccak-256 hash
     */
    public static Selector of(final String signature) {
        Objects.requireNonNull(signature, "signature");
        final byte[] hash = Keccak256.hash(signature.getBytes(StandardCharsets.UTF_8));
        return fromBytes(Arrays.copyOf(hash, BYTE_LENGTH));
    }

    public static Selector fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Selector must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Selector("0x" + Hex.encodeNoPrefix(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /**
     * Combines two selectors bitwise, the ERC-165 way of deriving an interface id.
     *
     * @param other the selector to fold in
     * @return {@code this ^ other}
     */
    public Selector xor(final Selector other) {
        Objects.requireNonNull(other, "other");
        final byte[] left = toBytes();
        final byte[] right = other.toBytes();
        for (int i = 0; i < BYTE_LENGTH; i++) {
            left[i] ^= right[i];
        }
        return fromBytes(left);
    }

    @Override
    public String toString() {
        return value;
    }
}
