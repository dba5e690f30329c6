// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs proxy operations as all-or-nothing units.
 *
 * <p>
 * Before an operation every participant is checkpointed. If the operation throws,
 * the checkpoints are restored in reverse registration order and the exception is
 * rethrown unchanged; a checkpoint that fails to restore is attached to it as a
 * suppressed exception and the remaining checkpoints are still restored.
 *
 * <p>
 * Operations nest: a call that re-enters the proxy from a forwarded call gets its
 * own checkpoints, and participants are committed only when the outermost
 * operation returns.
 *
 * <p>
 * Operations are serialized on this journal's monitor. The monitor is reentrant,
 * so a callback arriving on the operation's own thread proceeds (and meets the
 * {@link ReentrancyGuard}) instead of deadlocking. Reads go through
 * {@link #read(Supplier)} so another thread never sees an operation half applied.
 *
 * @since 0.1.0
 */
public final class StateJournal {

    private static final Logger log = LoggerFactory.getLogger(StateJournal.class);

    private final List<Journaled> participants;
    private int depth;

    public StateJournal(final List<? extends Journaled> participants) {
        Objects.requireNonNull(participants, "participants");
        this.participants = List.copyOf(participants);
    }

    /**
     * Executes {@code operation} atomically.
     *
     * @param name      operation name used in log output
     * @param operation the work to run
     * @param <T>       result type
     * @return the operation's result
     */
    public synchronized <T> T atomically(final String name, final Supplier<T> operation) {
        Objects.requireNonNull(operation, "operation");
        List<Checkpoint> checkpoints = new ArrayList<>(participants.size());
        for (Journaled participant : participants) {
            checkpoints.add(participant.checkpoint());
        }
        depth++;
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            for (int i = checkpoints.size() - 1; i >= 0; i--) {
                try {
                    checkpoints.get(i).restore();
                } catch (RuntimeException restoreFailure) {
                    e.addSuppressed(restoreFailure);
                }
            }
            log.warn("{} rolled back at depth {}: {}", name, depth, e.toString());
            throw e;
        } finally {
            depth--;
        }
        if (depth == 0) {
            for (Journaled participant : participants) {
                participant.commit();
            }
            log.debug("{} committed", name);
        }
        return result;
    }

    /**
     * Executes {@code operation} atomically, for work without a result.
     */
    public synchronized void run(final String name, final Runnable operation) {
        Objects.requireNonNull(operation, "operation");
        atomically(name, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Evaluates {@code query} while holding the journal's monitor, between operations.
     */
    public synchronized <T> T read(final Supplier<T> query) {
        Objects.requireNonNull(query, "query");
        return query.get();
    }

    /**
     * @return the number of operations currently executing on this journal
     */
    public synchronized int depth() {
        return depth;
    }
}
