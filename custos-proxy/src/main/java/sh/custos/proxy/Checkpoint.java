// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

/**
 * Saved state of a {@link Journaled} participant.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Checkpoint {

    /**
     * Puts the participant back into the state it had when the checkpoint was taken.
     */
    void restore();
}
