// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

/**
 * Solidity boolean.
 *
 * @param value the boolean value
 * @since 0.1.0
 */
public record Bool(boolean value) implements StaticAbiType {
    @Override
    public String typeName() {
        return "bool";
    }
}
