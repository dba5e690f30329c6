// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

import java.util.Objects;

import sh.custos.core.types.HexData;

/**
 * A byte string argument. Dynamic values encode as {@code bytes}: a length word
 * followed by the padded content in the tail. Fixed values encode as
 * {@code bytesN}: left aligned in one head word.
 *
 * @param value     the content
 * @param isDynamic {@code true} for {@code bytes}
 * @since 0.1.0
 */
public record Bytes(HexData value, boolean isDynamic) implements DynamicAbiType {

    private static final int WORD_SIZE = 32;

    public Bytes {
        Objects.requireNonNull(value, "value");
        if (!isDynamic && (value.byteLength() == 0 || value.byteLength() > WORD_SIZE)) {
            throw new IllegalArgumentException("bytesN holds 1 to 32 bytes, got " + value.byteLength());
        }
    }

    /** Calldata payloads, signatures and other variable-length content. */
    public static Bytes dynamic(final HexData data) {
        return new Bytes(data, true);
    }

    /** Merkle proof nodes and other fixed-width words. */
    public static Bytes fixed(final byte[] data) {
        return new Bytes(HexData.fromBytes(data), false);
    }

    @Override
    public int byteSize() {
        return WORD_SIZE;
    }

    @Override
    public String typeName() {
        return isDynamic ? "bytes" : "bytes" + value.byteLength();
    }
}
