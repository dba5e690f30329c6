// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core;

/**
 * Global toggle for verbose debug logging across Custos modules.
 *
 * <p>The flags are volatile; {@link #isEnabled()} reads them non-atomically,
 * which only affects whether a trace line is emitted.
 *
 * @since 0.1.0
 */
public final class CustosDebug {

    private static volatile boolean callLogging = false;
    private static volatile boolean signatureLogging = false;

    private CustosDebug() {
    }

    /**
     * @return true if either call or signature logging is enabled
     */
    public static boolean isEnabled() {
        return callLogging || signatureLogging;
    }

    public static void setEnabled(final boolean enabled) {
        callLogging = enabled;
        signatureLogging = enabled;
    }

    public static void setCallLogging(final boolean enabled) {
        callLogging = enabled;
    }

    public static boolean isCallLoggingEnabled() {
        return callLogging;
    }

    public static void setSignatureLogging(final boolean enabled) {
        signatureLogging = enabled;
    }

    public static boolean isSignatureLoggingEnabled() {
        return signatureLogging;
    }
}
