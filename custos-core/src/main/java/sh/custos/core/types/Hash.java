// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.custos.core.crypto.Keccak256;
import sh.custos.primitives.Hex;

/**
 * A 32-byte digest: the subject of an ERC-1271 signature check, or one node of
 * a reward claim's merkle proof.
 *
 * @since 0.1.0
 */
public record Hash(@com.fasterxml.jackson.annotation.JsonValue String value) {

    private static final Pattern FORMAT = HexValidator.fixedLength(Keccak256.DIGEST_LENGTH);

    public Hash {
        Objects.requireNonNull(value, "value");
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("not a 32-byte hex digest: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * @return the Keccak-256 digest of {@code data}
     */
    public static Hash keccak(final byte[] data) {
        return fromBytes(Keccak256.hash(data));
    }

    /**
     * @throws IllegalArgumentException unless {@code bytes} holds exactly 32 bytes
     */
    public static Hash fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != Keccak256.DIGEST_LENGTH) {
            throw new IllegalArgumentException("digest must be 32 bytes, got " + bytes.length);
        }
        return new Hash(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }
}
