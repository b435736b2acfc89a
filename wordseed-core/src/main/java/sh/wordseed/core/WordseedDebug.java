// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core;

/**
 * Global toggle for enabling verbose debug logging across wordseed modules.
 *
 * <p>Thread safety: The individual boolean fields are volatile, ensuring visibility
 * across threads. The compound check in {@link #isEnabled()} is not atomic; a brief
 * inconsistency between flags only affects whether a trace line is emitted.
 */
public final class WordseedDebug {

    private static volatile boolean codecLogging = false;
    private static volatile boolean wordlistLogging = false;

    private WordseedDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either codec or wordlist logging is enabled
     */
    public static boolean isEnabled() {
        return codecLogging || wordlistLogging;
    }

    public static void setEnabled(final boolean enabled) {
        codecLogging = enabled;
        wordlistLogging = enabled;
    }

    public static void setCodecLogging(final boolean enabled) {
        codecLogging = enabled;
    }

    public static boolean isCodecLoggingEnabled() {
        return codecLogging;
    }

    public static void setWordlistLogging(final boolean enabled) {
        wordlistLogging = enabled;
    }

    public static boolean isWordlistLoggingEnabled() {
        return wordlistLogging;
    }
}
