// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

/**
 * State that takes part in the atomic execution of a proxy operation.
 *
 * @see StateJournal
 * @since 0.1.0
 */
public interface Journaled {

    /**
     * Captures the current state.
     *
     * @return a checkpoint that restores it
     */
    Checkpoint checkpoint();

    /**
     * Called once the outermost operation completed successfully.
     */
    default void commit() {
    }
}
