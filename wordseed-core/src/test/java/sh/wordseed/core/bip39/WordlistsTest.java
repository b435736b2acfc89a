// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.bip39;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.wordseed.core.crypto.Sha256;
import sh.wordseed.core.error.WordlistException;
import sh.wordseed.primitives.Hex;

/**
 * Tests for the bundled English wordlist and the stream loaders.
 */
class WordlistsTest {

    @Nested
    class English {

        private final Wordlist english = Wordlists.english();

        @Test
        void isSharedInstance() {
            assertSame(english, Wordlists.english());
            assertEquals("english", english.language());
        }

        @Test
        void firstAndLastWords() {
            assertEquals("abandon", english.word(0));
            assertEquals("zoo", english.word(2047));
        }

        @Test
        void wordsAtKnownIndices() {
            assertEquals("ability", english.word(1));
            assertEquals("able", english.word(2));
            assertEquals("about", english.word(3));
            assertEquals("zero", english.word(2045));
            assertEquals("zone", english.word(2046));
        }

        @Test
        void indexOfKnownWords() {
            assertEquals(OptionalInt.of(0), english.indexOf("abandon"));
            assertEquals(OptionalInt.of(1019), english.indexOf("legal"));
            assertEquals(OptionalInt.of(2047), english.indexOf("zoo"));
            assertEquals(OptionalInt.empty(), english.indexOf("notaword"));
            assertEquals(OptionalInt.empty(), english.indexOf(""));
        }

        @Test
        void indexRoundTrip() {
            for (int i = 0; i < Wordlist.SIZE; i++) {
                assertEquals(OptionalInt.of(i), english.indexOf(english.word(i)), "Round trip failed for index " + i);
            }
        }

        @Test
        void wordsAreLowercaseAndSorted() {
            for (int i = 0; i < Wordlist.SIZE; i++) {
                String word = english.word(i);
                assertEquals(word.toLowerCase(), word, "Word at index " + i + " should be lowercase");
                if (i > 0) {
                    assertTrue(english.word(i - 1).compareTo(word) < 0, "Words should be sorted at index " + i);
                }
            }
        }

        @Test
        void firstFourLettersAreUnique() {
            long distinctPrefixes = english.words().stream()
                    .map(w -> w.substring(0, Math.min(4, w.length())))
                    .distinct()
                    .count();

            assertEquals(2048, distinctPrefixes);
        }

        @Test
        void bundledResourceMatchesPublishedDigest() throws IOException {
            try (InputStream is = Wordlists.class.getResourceAsStream(Wordlists.ENGLISH_RESOURCE)) {
                assertNotNull(is);
                assertEquals(Wordlists.ENGLISH_SHA256, Hex.encodeNoPrefix(Sha256.hash(is.readAllBytes())));
            }
        }
    }

    @Nested
    class Loading {

        private byte[] syntheticContent(String lineSeparator) {
            return String.join(lineSeparator, WordlistTest.syntheticWords()).getBytes(StandardCharsets.UTF_8);
        }

        @Test
        void loadsOneWordPerLine() {
            Wordlist wordlist = Wordlists.load(new ByteArrayInputStream(syntheticContent("\n")), "synthetic");

            assertEquals("w0000", wordlist.word(0));
            assertEquals("w2047", wordlist.word(2047));
        }

        @Test
        void toleratesCrlfAndBlankLines() {
            String content = "\r\n\r\n" + new String(syntheticContent("\r\n"), StandardCharsets.UTF_8) + "\r\n\r\n";

            Wordlist wordlist = Wordlists.load(
                    new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), "synthetic");

            assertEquals("w1000", wordlist.word(1000));
        }

        @Test
        void verifiesDigestWhenGiven() {
            byte[] content = syntheticContent("\n");
            String digest = Hex.encode(Sha256.hash(content));

            Wordlist wordlist = Wordlists.load(new ByteArrayInputStream(content), "synthetic", digest);

            assertEquals(2048, wordlist.size());
        }

        @Test
        void rejectsDigestMismatch() {
            byte[] content = syntheticContent("\n");

            WordlistException e = assertThrows(WordlistException.class,
                    () -> Wordlists.load(new ByteArrayInputStream(content), "synthetic", Wordlists.ENGLISH_SHA256));
            assertTrue(e.getMessage().startsWith("Digest mismatch for synthetic wordlist"));
        }

        @Test
        void wrapsReadFailures() {
            InputStream broken = new InputStream() {
                @Override
                public int read() throws IOException {
                    throw new IOException("disk gone");
                }
            };

            WordlistException e = assertThrows(WordlistException.class, () -> Wordlists.load(broken, "broken"));
            assertInstanceOf(IOException.class, e.getCause());
        }

        @Test
        void missingResourceFails() {
            assertThrows(WordlistException.class, () -> Wordlists.fromResource("/no-such-wordlist.txt", "none"));
        }

        @Test
        void loadsFromClasspathResource() {
            Wordlist wordlist = Wordlists.fromResource(Wordlists.ENGLISH_RESOURCE, "english-copy");

            assertEquals("english-copy", wordlist.language());
            assertEquals(Wordlists.english().words(), wordlist.words());
        }
    }
}
