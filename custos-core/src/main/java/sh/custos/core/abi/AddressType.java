// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

import java.util.Objects;

import sh.custos.core.types.Address;

/**
 * Solidity address, left-padded to one slot.
 *
 * @param value the address
 * @since 0.1.0
 */
public record AddressType(Address value) implements StaticAbiType {
    public AddressType {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public String typeName() {
        return "address";
    }
}
