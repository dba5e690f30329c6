// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.error;

import java.util.Objects;

import sh.custos.core.error.ProxyException;
import sh.custos.core.types.Address;
import sh.custos.proxy.Role;

/**
 * Thrown when the caller does not hold the role an operation requires.
 *
 * <p>
 * Carries both the actual caller and the address the role is bound to, so the
 * rejection can be diagnosed without re-reading proxy state.
 *
 * @since 0.1.0
 */
public final class UnauthorizedCallerException extends ProxyException {

    private final Address actual;
    private final Address expected;
    private final Role role;

    public UnauthorizedCallerException(final Address actual, final Address expected, final Role role) {
        super("caller " + actual + " is not the " + role.label() + " (expected " + expected + ")");
        this.actual = Objects.requireNonNull(actual, "actual");
        this.expected = Objects.requireNonNull(expected, "expected");
        this.role = Objects.requireNonNull(role, "role");
    }

    public Address actual() {
        return actual;
    }

    public Address expected() {
        return expected;
    }

    public Role role() {
        return role;
    }
}
