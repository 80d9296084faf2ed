// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core;

import java.util.regex.Pattern;

/**
 * Removes sensitive data from debug log payloads.
 *
 * <p>
 * Redacts signature material, HSM credential labels and HTTP basic-auth values, then
 * truncates excessively long output.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Matches "signature":"..." and "signatures":[...] JSON values. */
    private static final Pattern SIGNATURE_PATTERN =
            Pattern.compile("\"signature\"\\s*:\\s*\"[^\"]+\"");

    private static final String SIGNATURE_REPLACEMENT = "\"signature\":\"***[REDACTED]***\"";

    private static final Pattern SIGNATURES_PATTERN =
            Pattern.compile("\"signatures\"\\s*:\\s*\\[[^\\]]*\\]");

    private static final String SIGNATURES_REPLACEMENT = "\"signatures\":[\"***[REDACTED]***\"]";

    /** HSM passphrase-derived label. */
    private static final Pattern LABEL_PATTERN =
            Pattern.compile("\"label\"\\s*:\\s*\"[^\"]+\"");

    private static final String LABEL_REPLACEMENT = "\"label\":\"***[REDACTED]***\"";

    private static final Pattern BASIC_AUTH_PATTERN =
            Pattern.compile("Basic\\s+[A-Za-z0-9+/=]+");

    private static final String BASIC_AUTH_REPLACEMENT = "Basic ***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"signature\"")) {
            sanitized = SIGNATURE_PATTERN.matcher(sanitized).replaceAll(SIGNATURE_REPLACEMENT);
        }

        if (sanitized.contains("\"signatures\"")) {
            sanitized = SIGNATURES_PATTERN.matcher(sanitized).replaceAll(SIGNATURES_REPLACEMENT);
        }

        if (sanitized.contains("\"label\"")) {
            sanitized = LABEL_PATTERN.matcher(sanitized).replaceAll(LABEL_REPLACEMENT);
        }

        if (sanitized.contains("Basic")) {
            sanitized = BASIC_AUTH_PATTERN.matcher(sanitized).replaceAll(BASIC_AUTH_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
