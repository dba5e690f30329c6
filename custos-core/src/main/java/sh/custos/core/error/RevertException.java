// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.error;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;

/**
 * Exception thrown when an external call reverts.
 *
 * <p>
 * Raised by {@code ContractCaller} implementations when the callee rejects a
 * call. The proxy never catches it: the enclosing operation is aborted and its
 * effects are rolled back, then the exception reaches the original caller
 * unchanged.
 *
 * <pre>{@code
 * try {
 *     proxy.callAnyFunction(client, target, payload);
 * } catch (RevertException e) {
 *     System.err.println(e.target() + " reverted: " + e.revertReason());
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class RevertException extends CustosException {

    private final Address target;
    private final @Nullable String revertReason;
    private final HexData revertData;

    public RevertException(final Address target, final @Nullable String revertReason, final HexData revertData) {
        super(messageFor(target, revertReason, revertData));
        this.target = Objects.requireNonNull(target, "target");
        this.revertReason = revertReason;
        this.revertData = Objects.requireNonNull(revertData, "revertData");
    }

    private static String messageFor(final Address target, final @Nullable String reason, final HexData data) {
        return reason != null
                ? "call to " + target + " reverted: " + reason
                : "call to " + target + " reverted (no reason), rawData=" + data;
    }

    public Address target() {
        return target;
    }

    public @Nullable String revertReason() {
        return revertReason;
    }

    public HexData revertData() {
        return revertData;
    }
}
