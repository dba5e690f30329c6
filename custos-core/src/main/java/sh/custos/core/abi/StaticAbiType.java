// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

/**
 * Single-slot ABI types, always encoded in place as exactly 32 bytes.
 *
 * @see DynamicAbiType
 * @since 0.1.0
 */
public sealed interface StaticAbiType extends AbiType permits Bool, AddressType, UInt {

    @Override
    default int byteSize() {
        return 32;
    }

    @Override
    default boolean isDynamic() {
        return false;
    }
}
