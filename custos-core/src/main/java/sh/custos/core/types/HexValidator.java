// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.types;

import java.util.regex.Pattern;

/**
 * Utility for validating fixed-length hex strings.
 * <p>
 * Used by {@link Address}, {@link Hash} and {@link Selector} so every
 * fixed-width value type validates its input the same way.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Creates a compiled pattern that matches {@code 0x}-prefixed hex strings of
     * exactly {@code byteLength} bytes.
     *
     * @param byteLength the exact number of bytes the hex string must represent
     * @return a compiled pattern matching hex strings of the specified length
     */
    public static Pattern fixedLength(int byteLength) {
        int hexChars = byteLength * 2;
        return Pattern.compile("^0x[0-9a-fA-F]{" + hexChars + "}$");
    }
}
