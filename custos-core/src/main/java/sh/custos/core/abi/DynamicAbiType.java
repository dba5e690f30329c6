// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

/**
 * ABI types whose encoding may need offset-based indirection.
 * <p>
 * Some permitted types are static in certain configurations: {@code bytesN},
 * fixed-size arrays of static elements, and tuples with only static
 * components. Those override {@link #isDynamic()}.
 *
 * @since 0.1.0
 */
public sealed interface DynamicAbiType extends AbiType permits Bytes, Array, Tuple {

    @Override
    default boolean isDynamic() {
        return true;
    }
}
