// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.error;

/**
 * Thrown when a wordlist table cannot be built: wrong size, duplicate or blank
 * entries, digest mismatch, or an unreadable source.
 *
 * @since 0.1.0
 */
public final class WordlistException extends WordseedException {

    public WordlistException(final String message) {
        super(message);
    }

    public WordlistException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
