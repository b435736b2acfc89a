// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.error;

/**
 * Thrown when the secure random source cannot supply entropy.
 *
 * @since 0.1.0
 */
public final class RandomSourceException extends WordseedException {

    public RandomSourceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
