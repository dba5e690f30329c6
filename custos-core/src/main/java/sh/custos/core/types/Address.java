// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.custos.primitives.Hex;

/**
 * Hex-encoded 20-byte account address.
 * <p>
 * Identifies every party the proxy deals with: the client, the factory, the
 * treasury, the executor, asset tokens, vaults and forwarding targets.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so two spellings of one address compare equal.
 *
 * @since 0.1.0
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     * <p>
     * Stands for "unset": an uninitialized proxy reports it as its client.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether this is the {@link #ZERO} address.
     *
     * @return true for the zero address
     */
    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    /**
     * Decodes this address to a 20-byte array.
     *
     * @return 20-byte array representation
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
