// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.custos.core.types.HexData;
import sh.custos.primitives.Hex;

/**
 * secp256k1 ECDSA signature.
 *
 * <p>
 * A signature consists of three components:
 * <ul>
 * <li><b>r</b>: first 32 bytes</li>
 * <li><b>s</b>: second 32 bytes; verifiers require it canonical, see {@link Secp256k1#isCanonical}</li>
 * <li><b>v</b>: recovery id, either raw (0 or 1) or offset by 27</li>
 * </ul>
 *
 * <p>
 * The 65-byte packed form {@code r || s || v} with {@code v} in {27, 28} is what
 * contract-style signature checks receive; see {@link #fromBytes(byte[])} and
 * {@link #toBytes()}.
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature
 * @param v recovery id (0, 1, 27 or 28)
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    /** Length of the packed {@code r || s || v} form. */
    public static final int PACKED_LENGTH = 65;

    /**
     * Maximum bytes to display in full hex in toString().
     * Beyond this, just show the byte count to keep logs readable.
     */
    private static final int MAX_BYTES_TO_DISPLAY = 8;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");

        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        if (v != 0 && v != 1 && v != 27 && v != 28) {
            throw new IllegalArgumentException("v must be 0, 1, 27 or 28, got " + v);
        }

        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    /**
     * Parses the packed 65-byte {@code r || s || v} form.
     *
     * @param packed the packed signature
     * @return the signature
     * @throws IllegalArgumentException if the length or v byte is invalid
     */
    public static Signature fromBytes(final byte[] packed) {
        Objects.requireNonNull(packed, "packed signature cannot be null");
        if (packed.length != PACKED_LENGTH) {
            throw new IllegalArgumentException(
                    "packed signature must be " + PACKED_LENGTH + " bytes, got " + packed.length);
        }
        return new Signature(
                Arrays.copyOfRange(packed, 0, 32),
                Arrays.copyOfRange(packed, 32, 64),
                packed[64] & 0xFF);
    }

    /**
     * Encodes this signature as {@code r || s || v}, with v shifted into {27, 28}.
     *
     * @return the packed signature
     */
    public HexData toBytes() {
        final byte[] packed = new byte[PACKED_LENGTH];
        System.arraycopy(r, 0, packed, 0, 32);
        System.arraycopy(s, 0, packed, 32, 32);
        packed[64] = (byte) (27 + recoveryId());
        return HexData.fromBytes(packed);
    }

    /**
     * Returns a copy of the r component.
     *
     * @return a copy of the r bytes (32 bytes)
     */
    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    /**
     * Returns a copy of the s component.
     *
     * @return a copy of the s bytes (32 bytes)
     */
    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    /**
     * Returns the recovery id (y parity) regardless of the v encoding.
     *
     * @return 0 or 1
     */
    public int recoveryId() {
        return v >= 27 ? v - 27 : v;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Signature other))
            return false;
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && recoveryId() == other.recoveryId();
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), recoveryId());
    }

    @Override
    public String toString() {
        return "Signature[r=" + bytesToHex(r) + ", s=" + bytesToHex(s) + ", v=" + v + "]";
    }

    private static String bytesToHex(byte[] bytes) {
        if (bytes.length > MAX_BYTES_TO_DISPLAY) {
            return bytes.length + " bytes";
        }
        return Hex.encodeNoPrefix(bytes);
    }
}
