// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.error;

/**
 * Base runtime exception for all wordseed failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy, so every
 * mnemonic, entropy and wordlist failure can be caught with a single catch
 * clause while staying exhaustive over the known kinds.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * WordseedException
 * ├── {@link InvalidEntropyLengthException} - entropy not 128/160/192/224/256 bits
 * ├── {@link InvalidMnemonicLengthException} - word count not 12/15/18/21/24
 * ├── {@link UnknownWordException} - word missing from the wordlist
 * ├── {@link ChecksumMismatchException} - embedded checksum does not verify
 * ├── {@link RandomSourceException} - secure random source failed
 * └── {@link WordlistException} - malformed or unreadable wordlist table
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     byte[] entropy = codec.toEntropy(userInput);
 * } catch (UnknownWordException e) {
 *     highlight(e.position());
 * } catch (ChecksumMismatchException e) {
 *     // typo somewhere in the phrase
 * } catch (WordseedException e) {
 *     // any other failure
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class WordseedException extends RuntimeException
        permits InvalidEntropyLengthException,
        InvalidMnemonicLengthException,
        UnknownWordException,
        ChecksumMismatchException,
        RandomSourceException,
        WordlistException {

    public WordseedException(final String message) {
        super(message);
    }

    public WordseedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
