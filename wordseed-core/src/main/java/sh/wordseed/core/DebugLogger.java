// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for codec and wordlist traces.
 *
 * <p>Every message goes through {@link LogSanitizer} before it reaches SLF4J.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.wordseed.debug");

    private DebugLogger() {
    }

    public static void logCodec(final String message, final Object... args) {
        if (!WordseedDebug.isCodecLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logWordlist(final String message, final Object... args) {
        if (!WordseedDebug.isWordlistLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!WordseedDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
