// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.binding;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;
import sh.custos.proxy.Checkpoint;
import sh.custos.proxy.spi.ChainEnvironment;
import sh.custos.proxy.spi.ChainSnapshots;
import sh.custos.proxy.spi.ContractCaller;
import sh.custos.proxy.spi.Erc20Token;
import sh.custos.proxy.spi.Erc4626Vault;
import sh.custos.proxy.spi.SnapshotId;

/**
 * {@link ChainEnvironment} backed by a remote chain reached through a {@link ContractCaller}.
 *
 * <p>
 * Every call is its own remote call, so a failed operation may already have
 * moved funds on the chain. Checkpoints therefore take a chain snapshot, and
 * restoring one reverts the chain to it.
 *
 * @since 0.1.0
 */
public final class AbiChainEnvironment implements ChainEnvironment {

    private static final Logger log = LoggerFactory.getLogger(AbiChainEnvironment.class);

    private final ContractCaller caller;
    private final ChainSnapshots snapshots;

    public AbiChainEnvironment(final ContractCaller caller, final ChainSnapshots snapshots) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    }

    @Override
    public HexData call(final Address sender, final Address target, final HexData payload) {
        return caller.call(sender, target, payload);
    }

    @Override
    public Erc20Token token(final Address token) {
        return new AbiErc20Token(this, token);
    }

    @Override
    public Erc4626Vault vault(final Address vault) {
        return new AbiErc4626Vault(this, vault);
    }

    /**
     * @throws IllegalStateException on restore, if the chain refuses to revert
     */
    @Override
    public Checkpoint checkpoint() {
        final SnapshotId id = snapshots.snapshot();
        log.debug("chain snapshot {}", id.value());
        return () -> {
            if (!snapshots.revert(id)) {
                throw new IllegalStateException("chain did not revert to snapshot " + id.value());
            }
            log.debug("chain reverted to {}", id.value());
        };
    }
}
