// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.primitives;

/**
 * Lowercase hex codec for calldata, digests and addresses.
 *
 * <p>Encoders always emit lowercase. {@link #decode(String)} accepts either case,
 * with or without the {@code 0x} prefix.
 *
 * @since 0.1.0
 */
public final class Hex {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {
    }

    /**
     * @throws IllegalArgumentException if the input is null, odd in length or not hex
     */
    public static byte[] decode(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hex.startsWith("0x") || hex.startsWith("0X") ? 2 : 0;
        final int digits = hex.length() - start;
        if (digits % 2 != 0) {
            throw new IllegalArgumentException("odd number of hex digits in " + hex);
        }
        final byte[] out = new byte[digits / 2];
        for (int i = 0; i < out.length; i++) {
            final int pos = start + 2 * i;
            out[i] = (byte) (digit(hex, pos) << 4 | digit(hex, pos + 1));
        }
        return out;
    }

    /**
     * @return {@code 0x} followed by two lowercase digits per byte
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final StringBuilder out = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            out.append(DIGITS[(b >> 4) & 0x0F]).append(DIGITS[b & 0x0F]);
        }
        return out.toString();
    }

    private static int digit(final String hex, final int pos) {
        final char c = hex.charAt(pos);
        // Character.digit also accepts non-ASCII digits
        final int value = c < 128 ? Character.digit(c, 16) : -1;
        if (value < 0) {
            throw new IllegalArgumentException("invalid hex character '" + c + "' in " + hex);
        }
        return value;
    }
}
