// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

import java.util.List;
import java.util.Objects;

/**
 * Solidity array, dynamic ({@code T[]}) or fixed ({@code T[N]}).
 *
 * @param values          the elements
 * @param isDynamicLength true for 'T[]', false for 'T[N]'
 * @param elementTypeName the Solidity type name of elements (e.g., "bytes32")
 * @param <T>             the element type
 * @since 0.1.0
 */
public record Array<T extends AbiType>(List<T> values, boolean isDynamicLength, String elementTypeName)
        implements DynamicAbiType {
    public Array {
        Objects.requireNonNull(values, "values cannot be null");
        Objects.requireNonNull(elementTypeName, "elementTypeName cannot be null");
        values = List.copyOf(values);
    }

    public static <T extends AbiType> Array<T> dynamic(List<T> values, String elementTypeName) {
        return new Array<>(values, true, elementTypeName);
    }

    @Override
    public int byteSize() {
        if (isDynamic()) {
            return 32;
        }
        if (values.isEmpty()) {
            return 0;
        }
        return values.size() * values.get(0).byteSize();
    }

    @Override
    public boolean isDynamic() {
        if (isDynamicLength) {
            return true;
        }
        return !values.isEmpty() && values.get(0).isDynamic();
    }

    @Override
    public String typeName() {
        return elementTypeName + (isDynamicLength ? "[]" : "[" + values.size() + "]");
    }
}
