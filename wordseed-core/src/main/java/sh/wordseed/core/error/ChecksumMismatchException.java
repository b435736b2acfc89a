// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.error;

/**
 * Thrown when the checksum recomputed from a mnemonic's entropy disagrees with the
 * checksum bits embedded in its last word.
 *
 * @since 0.1.0
 */
public final class ChecksumMismatchException extends WordseedException {

    public ChecksumMismatchException(final int wordCount) {
        super("Mnemonic checksum mismatch (" + wordCount + " words)");
    }
}
