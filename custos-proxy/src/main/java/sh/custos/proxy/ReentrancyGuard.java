// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.util.function.Supplier;

import sh.custos.proxy.error.ReentrantCallException;

/**
 * Blocks nested entry into guarded operations.
 *
 * <p>
 * One flag covers every guarded operation: while any of them runs, entering any
 * other fails. The flag is cleared on every exit path.
 *
 * @since 0.1.0
 */
public final class ReentrancyGuard {

    private boolean entered;

    /**
     * Runs {@code body} with the guard held.
     *
     * @param operation name reported when entry is refused
     * @param body      the guarded work
     * @param <T>       result type
     * @return the body's result
     * @throws ReentrantCallException if a guarded operation is already running
     */
    public synchronized <T> T guard(final String operation, final Supplier<T> body) {
        if (entered) {
            throw new ReentrantCallException(operation);
        }
        entered = true;
        try {
            return body.get();
        } finally {
            entered = false;
        }
    }

    public synchronized boolean isEntered() {
        return entered;
    }
}
