// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.bip39;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.wordseed.core.DebugLogger;
import sh.wordseed.core.crypto.Sha256;
import sh.wordseed.core.error.WordlistException;
import sh.wordseed.primitives.Hex;

/**
 * Factory for {@link Wordlist} tables: the bundled English list and loaders for any
 * other list supplied as text, one word per line.
 *
 * <p>
 * The English table is read from the classpath and checked against the SHA-256 of
 * the published BIP-39 {@code english.txt} the first time {@link #english()} is
 * called, then shared for the lifetime of the class loader.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0039/bip-0039-wordlists.md">BIP-39 wordlists</a>
 * @since 0.1.0
 */
public final class Wordlists {

    private static final Logger LOG = LoggerFactory.getLogger(Wordlists.class);

    /** SHA-256 of the published BIP-39 English wordlist file. */
    public static final String ENGLISH_SHA256 =
            "2f5eed53a4727b4bf8880d8f3f199efc90e58503646d9ff8eff3a2ed3b24dbda";

    static final String ENGLISH_RESOURCE = "/bip39-english.txt";

    private Wordlists() {
        // Utility class
    }

    private static final class EnglishHolder {
        private static final Wordlist INSTANCE = fromResource(ENGLISH_RESOURCE, "english", ENGLISH_SHA256);
    }

    /**
     * Returns the bundled BIP-39 English wordlist.
     *
     * @return the shared English table
     */
    public static Wordlist english() {
        return EnglishHolder.INSTANCE;
    }

    /**
     * Loads a wordlist from a classpath resource.
     *
     * @param path     absolute resource path
     * @param language label for the table
     * @return the table
     * @throws WordlistException if the resource is missing, unreadable or not a valid wordlist
     */
    public static Wordlist fromResource(final String path, final String language) {
        return fromResource(path, language, null);
    }

    private static Wordlist fromResource(
            final String path, final String language, final @Nullable String expectedSha256Hex) {
        Objects.requireNonNull(path, "path cannot be null");
        try (InputStream is = Wordlists.class.getResourceAsStream(path)) {
            if (is == null) {
                throw new WordlistException("Resource not found: " + path);
            }
            return load(is, language, expectedSha256Hex);
        } catch (IOException e) {
            throw new WordlistException("Failed to read wordlist resource " + path, e);
        }
    }

    /**
     * Reads a wordlist from a UTF-8 stream, one word per line. Surrounding whitespace
     * is trimmed and blank lines are skipped. The stream is not closed.
     *
     * @param in       the source
     * @param language label for the table
     * @return the table
     * @throws WordlistException if the stream cannot be read or is not a valid wordlist
     */
    public static Wordlist load(final InputStream in, final String language) {
        return load(in, language, null);
    }

    /**
     * Reads a wordlist from a UTF-8 stream and verifies the SHA-256 of the raw bytes.
     *
     * @param in                the source
     * @param language          label for the table
     * @param expectedSha256Hex expected digest of the stream content, or null to skip the check
     * @return the table
     * @throws WordlistException if the stream cannot be read, the digest differs, or the
     *                           content is not a valid wordlist
     */
    public static Wordlist load(
            final InputStream in, final String language, final @Nullable String expectedSha256Hex) {
        Objects.requireNonNull(in, "in cannot be null");
        Objects.requireNonNull(language, "language cannot be null");

        final byte[] content;
        try {
            content = in.readAllBytes();
        } catch (IOException e) {
            throw new WordlistException("Failed to read " + language + " wordlist", e);
        }

        if (expectedSha256Hex != null) {
            final String actual = Hex.encodeNoPrefix(Sha256.hash(content));
            if (!actual.equalsIgnoreCase(Hex.cleanPrefix(expectedSha256Hex))) {
                throw new WordlistException(
                        "Digest mismatch for " + language + " wordlist: expected " + expectedSha256Hex + ", got " + actual);
            }
        }

        final var words = new ArrayList<String>(Wordlist.SIZE);
        for (String line : new String(content, StandardCharsets.UTF_8).split("\\R")) {
            final String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                words.add(trimmed);
            }
        }

        final Wordlist wordlist = Wordlist.of(language, words);
        LOG.debug("Loaded {} wordlist ({} words, digest checked: {})",
                language, wordlist.size(), expectedSha256Hex != null);
        DebugLogger.logWordlist("[WORDLIST] language=%s size=%d", language, wordlist.size());
        return wordlist;
    }
}
