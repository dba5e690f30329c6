// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifier of a chain state snapshot, as returned by {@code evm_snapshot}.
 *
 * @param value the hex-encoded id
 * @since 0.1.0
 */
public record SnapshotId(@com.fasterxml.jackson.annotation.JsonValue String value) {

    private static final Pattern HEX_QUANTITY = Pattern.compile("^0x[0-9a-fA-F]+$");

    public SnapshotId {
        Objects.requireNonNull(value, "snapshot id must not be null");
        if (!HEX_QUANTITY.matcher(value).matches()) {
            throw new IllegalArgumentException("snapshot id must be a 0x-prefixed hex quantity: " + value);
        }
    }
}
