// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Solidity tuple (struct).
 *
 * @param components the component values in declaration order
 * @since 0.1.0
 */
public record Tuple(List<AbiType> components) implements DynamicAbiType {
    public Tuple {
        Objects.requireNonNull(components, "components cannot be null");
        components = List.copyOf(components);
    }

    public static Tuple of(AbiType... components) {
        return new Tuple(List.of(components));
    }

    @Override
    public int byteSize() {
        if (isDynamic()) {
            return 32;
        }
        return components.stream().mapToInt(AbiType::byteSize).sum();
    }

    @Override
    public boolean isDynamic() {
        return components.stream().anyMatch(AbiType::isDynamic);
    }

    @Override
    public String typeName() {
        return components.stream()
                .map(AbiType::typeName)
                .collect(Collectors.joining(",", "(", ")"));
    }
}
