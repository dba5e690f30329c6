// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Values of the {@code privateKey}, {@code signature} and {@code raw} keys are
 * redacted in both JSON ({@code "key":"0x..."}) and key-value
 * ({@code key=0x...}) form, and output longer than 2000 characters is truncated.
 *
 * @since 0.1.0
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String REDACTED = "0x***[REDACTED]***";

    private static final List<String> SENSITIVE_KEYS = List.of("privateKey", "signature", "raw");

    private static final List<Redaction> REDACTIONS = SENSITIVE_KEYS.stream()
            .flatMap(key -> Stream.of(
                    new Redaction(key,
                            Pattern.compile("\"" + key + "\"\\s*:\\s*\"0x[^\"]*\""),
                            "\"" + key + "\":\"" + REDACTED + "\""),
                    new Redaction(key,
                            Pattern.compile("\\b" + key + "=0x[0-9a-fA-F]*"),
                            key + "=" + REDACTED)))
            .toList();

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;
        for (Redaction redaction : REDACTIONS) {
            if (sanitized.contains(redaction.key())) {
                sanitized = redaction.pattern().matcher(sanitized).replaceAll(redaction.replacement());
            }
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }

    private record Redaction(String key, Pattern pattern, String replacement) {
    }
}
