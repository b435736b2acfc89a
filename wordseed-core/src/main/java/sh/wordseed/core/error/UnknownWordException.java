// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.error;

/**
 * Thrown when a mnemonic contains a word that is not in the codec's wordlist.
 *
 * <p>
 * Carries the offending word and its zero-based position so user interfaces can
 * point at the typo without re-parsing the phrase.
 *
 * @since 0.1.0
 */
public final class UnknownWordException extends WordseedException {

    private final String word;
    private final int position;

    public UnknownWordException(final String word, final int position, final String language) {
        super("Word '" + word + "' at position " + position + " is not in the " + language + " wordlist");
        this.word = word;
        this.position = position;
    }

    public String word() {
        return word;
    }

    public int position() {
        return position;
    }
}
