// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.util.Objects;

import sh.custos.core.types.Address;

/**
 * Immutable addresses a proxy is deployed with.
 *
 * <pre>{@code
 * ProxyConfig config = ProxyConfig.builder()
 *         .proxyAddress(proxy)
 *         .executor(bundler)
 *         .factory(factory)
 *         .treasury(treasury)
 *         .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ProxyConfig {

    private final Address proxyAddress;
    private final Address executor;
    private final Address factory;
    private final Address treasury;

    private ProxyConfig(
            final Address proxyAddress,
            final Address executor,
            final Address factory,
            final Address treasury) {
        this.proxyAddress = proxyAddress;
        this.executor = executor;
        this.factory = factory;
        this.treasury = treasury;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the proxy's own address, the sender of every call it makes
     */
    public Address proxyAddress() {
        return proxyAddress;
    }

    public Address executor() {
        return executor;
    }

    public Address factory() {
        return factory;
    }

    public Address treasury() {
        return treasury;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ProxyConfig other)) {
            return false;
        }
        return proxyAddress.equals(other.proxyAddress)
                && executor.equals(other.executor)
                && factory.equals(other.factory)
                && treasury.equals(other.treasury);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proxyAddress, executor, factory, treasury);
    }

    @Override
    public String toString() {
        return "ProxyConfig{"
                + "proxyAddress=" + proxyAddress
                + ", executor=" + executor
                + ", factory=" + factory
                + ", treasury=" + treasury
                + '}';
    }

    /**
     * Builder for {@link ProxyConfig}. Every address is required and must be non-zero.
     */
    public static final class Builder {
        private Address proxyAddress;
        private Address executor;
        private Address factory;
        private Address treasury;

        private Builder() {
        }

        public Builder proxyAddress(final Address proxyAddress) {
            this.proxyAddress = requireNonZero(proxyAddress, "proxyAddress");
            return this;
        }

        public Builder executor(final Address executor) {
            this.executor = requireNonZero(executor, "executor");
            return this;
        }

        public Builder factory(final Address factory) {
            this.factory = requireNonZero(factory, "factory");
            return this;
        }

        public Builder treasury(final Address treasury) {
            this.treasury = requireNonZero(treasury, "treasury");
            return this;
        }

        /**
         * @throws IllegalStateException if an address was not set
         */
        public ProxyConfig build() {
            requireSet(proxyAddress, "proxyAddress");
            requireSet(executor, "executor");
            requireSet(factory, "factory");
            requireSet(treasury, "treasury");
            return new ProxyConfig(proxyAddress, executor, factory, treasury);
        }

        private static Address requireNonZero(final Address address, final String name) {
            Objects.requireNonNull(address, name + " must not be null");
            if (address.isZero()) {
                throw new IllegalArgumentException(name + " must not be the zero address");
            }
            return address;
        }

        private static void requireSet(final Address address, final String name) {
            if (address == null) {
                throw new IllegalStateException(name + " is required");
            }
        }
    }
}
