// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core;

import java.util.regex.Pattern;

/**
 * Utility that removes secret material from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts mnemonic, passphrase, entropy and seed values, whether written as
 * JSON ({@code "seed":"..."}) or as {@code key=value}</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Logs exceeding this will be truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String SECRET_KEYS = "mnemonic|passphrase|entropy|seed";

    /** Matches "mnemonic":"..." style JSON values. */
    private static final Pattern JSON_SECRET_PATTERN =
            Pattern.compile("\"(" + SECRET_KEYS + ")\"\\s*:\\s*\"[^\"]*\"");

    /** Matches mnemonic=... style values up to the next comma, semicolon or closing bracket. */
    private static final Pattern KEY_VALUE_SECRET_PATTERN =
            Pattern.compile("\\b(" + SECRET_KEYS + ")=[^,;)\\]}]*");

    private static final String JSON_REPLACEMENT = "\"$1\":\"***[REDACTED]***\"";
    private static final String KEY_VALUE_REPLACEMENT = "$1=***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = JSON_SECRET_PATTERN.matcher(input).replaceAll(JSON_REPLACEMENT);
        sanitized = KEY_VALUE_SECRET_PATTERN.matcher(sanitized).replaceAll(KEY_VALUE_REPLACEMENT);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
