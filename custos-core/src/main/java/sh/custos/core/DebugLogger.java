// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized opt-in trace logger. Output goes to the {@code sh.custos.debug}
 * logger after {@link LogSanitizer} has processed it.
 *
 * @since 0.1.0
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.custos.debug");

    private DebugLogger() {
    }

    /**
     * Logs a forwarded or outbound contract call.
     */
    public static void logCall(final String message, final Object... args) {
        if (!CustosDebug.isCallLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Logs signature verification material.
     */
    public static void logSignature(final String message, final Object... args) {
        if (!CustosDebug.isSignatureLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void log(final String message, final Object... args) {
        if (!CustosDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
