// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.custos.primitives.Hex;

/**
 * Arbitrary-length hexadecimal-encoded byte data with "0x" prefix.
 *
 * <p>
 * Carries the opaque payloads the proxy forwards (calldata), call return
 * data, revert data and signatures.
 *
 * <p>
 * <strong>Validation:</strong> The value must:
 * <ul>
 * <li>Start with "0x" prefix</li>
 * <li>Contain only hex characters (0-9, a-f, A-F)</li>
 * <li>Have an even number of hex digits (each byte = 2 hex chars)</li>
 * </ul>
 *
 * <pre>{@code
 * HexData empty = HexData.EMPTY;
 * HexData data = new HexData("0x1234abcd");
 * HexData fromBytes = HexData.fromBytes(new byte[] { 0x12, 0x34 });
 * byte[] decoded = data.toBytes();
 * }</pre>
 * <p>
 * Instances are immutable. An instance created from bytes defers building its
 * hex string until {@link #value()} is first called.
 *
 * @since 0.1.0
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");
    public static final HexData EMPTY = new HexData(new byte[0]);

    private volatile String value;
    private final byte[] raw;

    /**
     * Creates a HexData from a hex string.
     *
     * @param value the hex-encoded string with "0x" prefix
     */
    public HexData(String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
        this.value = Hex.encode(raw);
    }

    private HexData(byte[] raw) {
        this.raw = raw;
        this.value = null;
    }

    /**
     * Returns the lowercase hex string representation with "0x" prefix.
     *
     * @return the hex string
     */
    public String value() {
        String v = value;
        if (v == null) {
            v = Hex.encode(raw);
            value = v;
        }
        return v;
    }

    /**
     * Returns the number of bytes represented.
     *
     * @return the byte length
     */
    public int byteLength() {
        return raw.length;
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    /**
     * Decodes this hex data into raw bytes.
     *
     * @return a fresh copy of the bytes
     */
    public byte[] toBytes() {
        return raw.clone();
    }

    /**
     * Returns the bytes in {@code [from, to)} as new hex data.
     *
     * @param from first byte index, inclusive
     * @param to   last byte index, exclusive
     * @return the sub-range
     * @throws IllegalArgumentException if the range is outside this data
     */
    public HexData slice(final int from, final int to) {
        if (from < 0 || to < from || to > raw.length) {
            throw new IllegalArgumentException(
                    "slice [" + from + ", " + to + ") out of bounds for length " + raw.length);
        }
        return fromBytes(Arrays.copyOfRange(raw, from, to));
    }

    /**
     * Creates HexData from raw bytes.
     *
     * @param bytes the byte array to encode, or null/empty for {@link #EMPTY}
     * @return HexData holding a copy of {@code bytes}
     */
    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HexData other))
            return false;
        return Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return value();
    }
}
