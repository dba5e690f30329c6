// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.spi;

/**
 * Snapshot and revert of a remote chain's whole state, in the manner of the
 * {@code evm_snapshot} and {@code evm_revert} methods of development nodes.
 *
 * <p>
 * Reverting consumes the snapshot and every snapshot taken after it.
 *
 * @since 0.1.0
 */
public interface ChainSnapshots {

    /**
     * @return an id for the chain's current state
     */
    SnapshotId snapshot();

    /**
     * Puts the chain back into the state captured by {@code id}.
     *
     * @return true if the chain reverted
     */
    boolean revert(SnapshotId id);
}
