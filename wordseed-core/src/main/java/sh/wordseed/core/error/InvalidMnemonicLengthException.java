// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.error;

/**
 * Thrown when a mnemonic does not have 12, 15, 18, 21 or 24 words.
 *
 * @since 0.1.0
 */
public final class InvalidMnemonicLengthException extends WordseedException {

    private final int wordCount;

    public InvalidMnemonicLengthException(final int wordCount) {
        super("Mnemonic must have 12, 15, 18, 21 or 24 words, got " + wordCount);
        this.wordCount = wordCount;
    }

    public int wordCount() {
        return wordCount;
    }
}
