// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

/**
 * A Solidity value that can be ABI-encoded.
 *
 * @see AbiEncoder
 * @since 0.1.0
 */
public sealed interface AbiType permits StaticAbiType, DynamicAbiType {

    /**
     * Returns the size this value occupies in the head of an enclosing tuple:
     * 32 for every single-slot or dynamic value, the sum of the components for
     * a static tuple or static array.
     */
    int byteSize();

    /**
     * Returns true if this type is dynamic (bytes, T[], or a tuple/array
     * containing dynamic types).
     */
    boolean isDynamic();

    /**
     * Returns the canonical Solidity type name (e.g., "uint256", "bytes32[]").
     */
    String typeName();
}
