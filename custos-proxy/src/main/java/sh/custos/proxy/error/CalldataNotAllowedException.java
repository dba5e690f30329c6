// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import sh.custos.core.error.ProxyException;
import sh.custos.core.types.Address;
import sh.custos.core.types.Selector;
import sh.custos.proxy.OperationKind;

/**
 * Thrown by an allow-list checker that rejects a forwarded instruction.
 *
 * @since 0.1.0
 */
public final class CalldataNotAllowedException extends ProxyException {

    private final Address target;
    private final Selector selector;
    private final OperationKind kind;

    public CalldataNotAllowedException(final Address target, final Selector selector, final OperationKind kind) {
        super(kind + " call " + selector + " to " + target + " is not allowed");
        this.target = target;
        this.selector = selector;
        this.kind = kind;
    }

    public Address target() {
        return target;
    }

    public Selector selector() {
        return selector;
    }

    public OperationKind kind() {
        return kind;
    }
}
