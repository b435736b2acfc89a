// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.bip39;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

import sh.wordseed.core.DebugLogger;
import sh.wordseed.core.crypto.Pbkdf2;
import sh.wordseed.core.error.ChecksumMismatchException;
import sh.wordseed.core.error.InvalidEntropyLengthException;
import sh.wordseed.core.error.InvalidMnemonicLengthException;
import sh.wordseed.core.error.UnknownWordException;
import sh.wordseed.core.error.WordseedException;
import sh.wordseed.primitives.UnsignedBytes;

/**
 * BIP-39 codec bound to one {@link Wordlist}: entropy to mnemonic, mnemonic back to
 * checksummed entropy, and mnemonic plus passphrase to a 64-byte seed.
 *
 * <p>
 * There is no shared default instance; callers build the codec for the language
 * they need and pass it where it is used.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MnemonicCodec codec = MnemonicCodec.of(Wordlists.english());
 *
 * byte[] entropy = EntropyGenerator.create().generate(128);
 * String mnemonic = codec.marshalEntropy(entropy);
 *
 * byte[] seed = codec.deriveSeed(mnemonic, "optional passphrase");
 * }</pre>
 *
 * <h2>Unmarshal contract</h2>
 *
 * <p>
 * {@link #unmarshalEntropy(String)} returns the entropy <em>with the checksum bits
 * still attached</em> at the low end, padded to {@code entropyBytes + 1} bytes. Use
 * {@link #toEntropy(String)}, or {@link #stripChecksum(byte[])} on the unmarshalled
 * value, to get the original entropy back.
 *
 * <p>
 * Instances are immutable and thread-safe.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0039.mediawiki">BIP-39</a>
 * @since 0.1.0
 */
public final class MnemonicCodec {

    private static final int PBKDF2_ITERATIONS = 2048;
    private static final int SEED_LENGTH_BYTES = 64;
    private static final String SALT_PREFIX = "mnemonic";

    private final Wordlist wordlist;
    private final boolean normalizeNfkd;

    private MnemonicCodec(final Wordlist wordlist, final boolean normalizeNfkd) {
        this.wordlist = wordlist;
        this.normalizeNfkd = normalizeNfkd;
    }

    /**
     * Creates a codec over the given table with default settings.
     *
     * @param wordlist the table to encode with
     * @return a new codec
     */
    public static MnemonicCodec of(final Wordlist wordlist) {
        return builder().wordlist(wordlist).build();
    }

    /**
     * Creates a codec from an ordered list of 2048 unique words.
     *
     * @param words the wordlist content
     * @return a new codec
     * @throws sh.wordseed.core.error.WordlistException if the words do not form a valid table
     */
    public static MnemonicCodec forWords(final List<String> words) {
        return of(Wordlist.of("custom", words));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Wordlist wordlist() {
        return wordlist;
    }

    public boolean normalizesNfkd() {
        return normalizeNfkd;
    }

    /**
     * Encodes entropy as a mnemonic.
     *
     * @param entropy 16, 20, 24, 28 or 32 bytes
     * @return 12 to 24 words joined by single spaces
     * @throws InvalidEntropyLengthException if the entropy length is not valid
     */
    public String marshalEntropy(final byte[] entropy) {
        Objects.requireNonNull(entropy, "entropy cannot be null");
        final EntropySize size = EntropySize.ofBits(entropy.length * 8);

        final BigInteger checksummed = Checksum.checksummedValue(entropy);
        final int[] indices = BitPacker.split(checksummed, size.wordCount());

        final var words = new StringBuilder();
        for (int i = 0; i < indices.length; i++) {
            if (i > 0) {
                words.append(' ');
            }
            words.append(wordlist.word(indices[i]));
        }

        DebugLogger.logCodec("[MARSHAL] language=%s entropyBits=%d words=%d",
                wordlist.language(), size.bits(), indices.length);
        return words.toString();
    }

    /**
     * Decodes a mnemonic and verifies its checksum.
     *
     * <p>
     * Words may be separated by any run of whitespace; leading and trailing whitespace
     * is ignored. Words are matched exactly against the table.
     *
     * @param mnemonic the phrase
     * @return entropy followed by its checksum bits, {@code entropyBytes + 1} bytes long
     * @throws InvalidMnemonicLengthException if the word count is not 12, 15, 18, 21 or 24
     * @throws UnknownWordException           if a word is not in the table
     * @throws ChecksumMismatchException      if the checksum does not verify
     */
    public byte[] unmarshalEntropy(final String mnemonic) {
        Objects.requireNonNull(mnemonic, "mnemonic cannot be null");
        final List<String> words = splitWords(normalize(mnemonic));

        final int wordCount = words.size();
        EntropySize.ofWordCount(wordCount);

        final int totalBits = wordCount * BitPacker.BITS_PER_WORD;
        final int checksumBits = totalBits % 32;
        final int fullByteSize = (totalBits - checksumBits) / 8 + 1;
        final int entropyByteSize = fullByteSize - (fullByteSize % 4);

        final int[] indices = new int[wordCount];
        for (int i = 0; i < wordCount; i++) {
            final OptionalInt index = wordlist.indexOf(words.get(i));
            if (index.isEmpty()) {
                throw new UnknownWordException(words.get(i), i, wordlist.language());
            }
            indices[i] = index.getAsInt();
        }

        final BigInteger checksummed = BitPacker.join(indices);
        final byte[] rawEntropy = UnsignedBytes.toBytes(checksummed.shiftRight(checksumBits), entropyByteSize);
        final byte[] checksummedBytes = UnsignedBytes.toBytes(checksummed, fullByteSize);
        final byte[] recomputed = UnsignedBytes.leftPad(Checksum.appendChecksum(rawEntropy), fullByteSize);

        try {
            if (!MessageDigest.isEqual(checksummedBytes, recomputed)) {
                Arrays.fill(checksummedBytes, (byte) 0);
                throw new ChecksumMismatchException(wordCount);
            }
        } finally {
            Arrays.fill(rawEntropy, (byte) 0);
            Arrays.fill(recomputed, (byte) 0);
        }

        DebugLogger.logCodec("[UNMARSHAL] language=%s words=%d checksumBits=%d",
                wordlist.language(), wordCount, checksumBits);
        return checksummedBytes;
    }

    /**
     * Decodes a mnemonic and returns the original entropy without checksum bits.
     *
     * @param mnemonic the phrase
     * @return 16 to 32 bytes of entropy
     * @throws WordseedException under the same conditions as {@link #unmarshalEntropy(String)}
     */
    public byte[] toEntropy(final String mnemonic) {
        final byte[] checksummed = unmarshalEntropy(mnemonic);
        try {
            return stripChecksum(checksummed);
        } finally {
            Arrays.fill(checksummed, (byte) 0);
        }
    }

    /**
     * Returns whether {@code mnemonic} decodes and verifies against this codec's table.
     *
     * @param mnemonic the phrase, may be null
     * @return true if {@link #unmarshalEntropy(String)} would succeed
     */
    public boolean isValid(final String mnemonic) {
        if (mnemonic == null || mnemonic.isBlank()) {
            return false;
        }
        try {
            Arrays.fill(unmarshalEntropy(mnemonic), (byte) 0);
            return true;
        } catch (WordseedException e) {
            return false;
        }
    }

    /**
     * Derives the 64-byte BIP-39 seed with PBKDF2-HMAC-SHA512, 2048 iterations.
     *
     * <p>
     * The mnemonic is validated first. The password is the mnemonic string itself as
     * supplied (NFKD-normalized only when the codec was built with
     * {@link Builder#normalizeNfkd(boolean)}), not the decoded entropy; the salt is
     * {@code "mnemonic" + passphrase}.
     *
     * @param mnemonic   the phrase
     * @param passphrase the passphrase, empty for none
     * @return 64-byte seed
     * @throws WordseedException under the same conditions as {@link #unmarshalEntropy(String)}
     */
    public byte[] deriveSeed(final String mnemonic, final String passphrase) {
        Objects.requireNonNull(mnemonic, "mnemonic cannot be null");
        Objects.requireNonNull(passphrase, "passphrase cannot be null");

        Arrays.fill(unmarshalEntropy(mnemonic), (byte) 0);

        final byte[] password = normalize(mnemonic).getBytes(StandardCharsets.UTF_8);
        final byte[] salt = (SALT_PREFIX + normalize(passphrase)).getBytes(StandardCharsets.UTF_8);
        try {
            return Pbkdf2.hmacSha512(password, salt, PBKDF2_ITERATIONS, SEED_LENGTH_BYTES);
        } finally {
            Arrays.fill(password, (byte) 0);
            Arrays.fill(salt, (byte) 0);
        }
    }

    /**
     * Generates fresh entropy and encodes it. The intermediate entropy is wiped.
     *
     * @param generator the entropy source
     * @param bitSize   128, 160, 192, 224 or 256
     * @return a new mnemonic
     * @throws InvalidEntropyLengthException if bitSize is not valid
     * @throws sh.wordseed.core.error.RandomSourceException if the random source fails
     */
    public String generateMnemonic(final EntropyGenerator generator, final int bitSize) {
        Objects.requireNonNull(generator, "generator cannot be null");
        final byte[] entropy = generator.generate(bitSize);
        try {
            return marshalEntropy(entropy);
        } finally {
            Arrays.fill(entropy, (byte) 0);
        }
    }

    /**
     * Number of words a mnemonic for {@code entropyBits} of entropy has.
     *
     * @param entropyBits 128, 160, 192, 224 or 256
     * @return 12, 15, 18, 21 or 24
     * @throws InvalidEntropyLengthException if entropyBits is not valid
     */
    public static int wordCount(final int entropyBits) {
        return EntropySize.ofBits(entropyBits).wordCount();
    }

    /**
     * Drops the trailing checksum bits from a value returned by
     * {@link #unmarshalEntropy(String)}.
     *
     * @param checksummed 17, 21, 25, 29 or 33 bytes of checksummed entropy
     * @return the entropy, one byte shorter
     * @throws InvalidEntropyLengthException if the input does not have a valid length
     */
    public static byte[] stripChecksum(final byte[] checksummed) {
        Objects.requireNonNull(checksummed, "checksummed cannot be null");
        final EntropySize size = EntropySize.ofBits((checksummed.length - 1) * 8);

        final BigInteger value = UnsignedBytes.toBigInteger(checksummed);
        return UnsignedBytes.toBytes(value.shiftRight(size.checksumBits()), size.bytes());
    }

    private String normalize(final String input) {
        return normalizeNfkd ? Normalizer.normalize(input, Normalizer.Form.NFKD) : input;
    }

    /** Splits on runs of whitespace or Unicode space separators, including U+3000. */
    static List<String> splitWords(final String mnemonic) {
        final var words = new ArrayList<String>(24);
        int start = -1;
        for (int i = 0; i < mnemonic.length(); i++) {
            if (Wordlist.isSeparator(mnemonic.charAt(i))) {
                if (start >= 0) {
                    words.add(mnemonic.substring(start, i));
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
        }
        if (start >= 0) {
            words.add(mnemonic.substring(start));
        }
        return words;
    }

    /**
     * Builder for {@link MnemonicCodec}.
     */
    public static final class Builder {
        private Wordlist wordlist;
        private boolean normalizeNfkd;

        Builder() {}

        /**
         * Sets the table to encode with. Required.
         *
         * @param wordlist the table
         * @return this builder
         */
        public Builder wordlist(final Wordlist wordlist) {
            this.wordlist = wordlist;
            return this;
        }

        /**
         * Applies Unicode NFKD to mnemonics and passphrases before use. Off by default,
         * in which case input strings are used exactly as supplied.
         *
         * @param normalizeNfkd whether to normalize
         * @return this builder
         */
        public Builder normalizeNfkd(final boolean normalizeNfkd) {
            this.normalizeNfkd = normalizeNfkd;
            return this;
        }

        /**
         * Builds the codec.
         *
         * @return the codec
         * @throws IllegalStateException if no wordlist was set
         */
        public MnemonicCodec build() {
            if (wordlist == null) {
                throw new IllegalStateException("wordlist is required");
            }
            return new MnemonicCodec(wordlist, normalizeNfkd);
        }
    }
}
