// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.bip39;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

import sh.wordseed.core.error.WordlistException;

/**
 * Immutable BIP-39 wordlist: exactly 2048 unique words and their inverse index.
 *
 * <p>
 * Both directions are built together from one ordered list in the constructor and
 * never change afterwards, so a table can be shared freely between threads and
 * codecs.
 *
 * @see Wordlists
 * @since 0.1.0
 */
public final class Wordlist {

    /** Number of words in every BIP-39 wordlist. */
    public static final int SIZE = 2048;

    private final String language;
    private final List<String> words;
    private final Map<String, Integer> wordToIndex;

    private Wordlist(final String language, final List<String> words, final Map<String, Integer> wordToIndex) {
        this.language = language;
        this.words = words;
        this.wordToIndex = wordToIndex;
    }

    /**
     * Builds a table from an ordered list of words.
     *
     * @param language a label used in error messages and logs
     * @param words    exactly 2048 unique, non-blank words without inner whitespace
     * @return the table
     * @throws NullPointerException if language, words or any word is null
     * @throws WordlistException    if the list is not a valid wordlist
     */
    public static Wordlist of(final String language, final List<String> words) {
        Objects.requireNonNull(language, "language cannot be null");
        Objects.requireNonNull(words, "words cannot be null");
        if (words.size() != SIZE) {
            throw new WordlistException(
                    "Invalid " + language + " wordlist size: expected " + SIZE + " words, got " + words.size());
        }

        final var copy = new ArrayList<String>(SIZE);
        final var index = new HashMap<String, Integer>(SIZE * 2);
        for (int i = 0; i < SIZE; i++) {
            final String word = Objects.requireNonNull(words.get(i), "word cannot be null");
            if (word.isEmpty() || word.codePoints().anyMatch(Wordlist::isSeparator)) {
                throw new WordlistException(
                        "Invalid " + language + " wordlist entry at index " + i + ": '" + word + "'");
            }
            final Integer previous = index.putIfAbsent(word, i);
            if (previous != null) {
                throw new WordlistException(
                        "Duplicate " + language + " wordlist entry '" + word + "' at indices " + previous + " and " + i);
            }
            copy.add(word);
        }

        return new Wordlist(language, Collections.unmodifiableList(copy), Collections.unmodifiableMap(index));
    }

    public String language() {
        return language;
    }

    public int size() {
        return SIZE;
    }

    /**
     * Returns the word at the specified index.
     *
     * @param index the wordlist index (0-2047)
     * @return the word at the given index
     * @throws IndexOutOfBoundsException if index is not in range [0, 2047]
     */
    public String word(final int index) {
        return words.get(index);
    }

    /**
     * Returns the index of the specified word.
     *
     * @param word the word to look up, matched exactly
     * @return the index (0-2047), or empty if the word is not in the table
     */
    public OptionalInt indexOf(final String word) {
        Objects.requireNonNull(word, "word cannot be null");
        final Integer index = wordToIndex.get(word);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public boolean contains(final String word) {
        return word != null && wordToIndex.containsKey(word);
    }

    /**
     * @return unmodifiable view of the words in index order
     */
    public List<String> words() {
        return words;
    }

    @Override
    public String toString() {
        return "Wordlist[" + language + ", " + SIZE + " words]";
    }

    static boolean isSeparator(final int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }
}
