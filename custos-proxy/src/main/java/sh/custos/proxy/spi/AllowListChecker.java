// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;
import sh.custos.core.types.Selector;
import sh.custos.proxy.OperationKind;

/**
 * Decides whether an instruction may be forwarded.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AllowListChecker {

    /**
     * Returns normally when the instruction is allowed.
     *
     * @param target    the contract the instruction is sent to
     * @param selector  the instruction's function selector
     * @param remainder the encoded arguments after the selector
     * @param kind      the declared purpose of the instruction
     * @throws sh.custos.proxy.error.CalldataNotAllowedException if the instruction is rejected
     */
    void checkCalldata(Address target, Selector selector, HexData remainder, OperationKind kind);
}
