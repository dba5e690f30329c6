// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Solidity unsigned integer (uint8 to uint256).
 *
 * @param width the bit width (multiple of 8, between 8 and 256)
 * @param value the value (non-negative and fitting in width)
 * @since 0.1.0
 */
public record UInt(int width, BigInteger value) implements StaticAbiType {
    public UInt {
        if (width % 8 != 0 || width < 8 || width > 256) {
            throw new IllegalArgumentException("Invalid uint width: " + width);
        }
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint cannot be negative");
        }
        if (value.bitLength() > width) {
            throw new IllegalArgumentException("value " + value + " too large for uint" + width);
        }
    }

    public static UInt uint256(BigInteger value) {
        return new UInt(256, value);
    }

    @Override
    public String typeName() {
        return "uint" + width;
    }
}
