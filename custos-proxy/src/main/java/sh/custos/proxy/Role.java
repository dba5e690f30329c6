// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

/**
 * Caller roles recognised by the proxy.
 *
 * @since 0.1.0
 */
public enum Role {
    /** The factory that created and initialized the proxy. */
    FACTORY("factory"),
    /** The single client whose assets the proxy holds. */
    CLIENT("client"),
    /** A third party the factory authorizes to claim rewards for the client. */
    OPERATOR("operator");

    private final String label;

    Role(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
