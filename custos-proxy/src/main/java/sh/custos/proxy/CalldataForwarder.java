// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.custos.core.DebugLogger;
import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;
import sh.custos.proxy.spi.ContractCaller;

/**
 * Sends validated instructions to external contracts from the proxy's address.
 *
 * <p>
 * No validation happens here; failures of the call propagate unchanged.
 *
 * @since 0.1.0
 */
public final class CalldataForwarder {

    private static final Logger log = LoggerFactory.getLogger(CalldataForwarder.class);

    private final ContractCaller caller;
    private final Address self;

    public CalldataForwarder(final ContractCaller caller, final Address self) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.self = Objects.requireNonNull(self, "self");
    }

    /**
     * @param target  the contract to call
     * @param payload the instruction
     * @return the call's return data
     */
    public HexData forward(final Address target, final HexData payload) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(payload, "payload");
        log.debug("forwarding {} bytes to {}", payload.byteLength(), target);
        DebugLogger.logCall("[FORWARD] from=%s target=%s data=%s", self, target, payload);
        return caller.call(self, target, payload);
    }
}
