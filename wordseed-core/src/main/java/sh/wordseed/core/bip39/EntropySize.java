// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.bip39;

import sh.wordseed.core.error.InvalidEntropyLengthException;
import sh.wordseed.core.error.InvalidMnemonicLengthException;

/**
 * The five entropy sizes BIP-39 allows, with their checksum width and mnemonic
 * length.
 *
 * <table>
 * <caption>Entropy sizes</caption>
 * <tr><th>Entropy bits</th><th>Checksum bits</th><th>Words</th></tr>
 * <tr><td>128</td><td>4</td><td>12</td></tr>
 * <tr><td>160</td><td>5</td><td>15</td></tr>
 * <tr><td>192</td><td>6</td><td>18</td></tr>
 * <tr><td>224</td><td>7</td><td>21</td></tr>
 * <tr><td>256</td><td>8</td><td>24</td></tr>
 * </table>
 *
 * @since 0.1.0
 */
public enum EntropySize {
    BITS_128(128),
    BITS_160(160),
    BITS_192(192),
    BITS_224(224),
    BITS_256(256);

    private final int bits;

    EntropySize(final int bits) {
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    public int bytes() {
        return bits / 8;
    }

    public int checksumBits() {
        return bits / 32;
    }

    public int wordCount() {
        return (bits + checksumBits()) / BitPacker.BITS_PER_WORD;
    }

    /**
     * Returns whether {@code bits} is a multiple of 32 in [128, 256].
     *
     * @param bits entropy length in bits
     * @return true for the five valid sizes
     */
    public static boolean isValid(final int bits) {
        return bits % 32 == 0 && bits >= 128 && bits <= 256;
    }

    /**
     * Looks up the size for an entropy length in bits.
     *
     * @param bits entropy length in bits
     * @return the matching size
     * @throws InvalidEntropyLengthException if {@code bits} is not one of the five valid sizes
     */
    public static EntropySize ofBits(final int bits) {
        if (!isValid(bits)) {
            throw new InvalidEntropyLengthException(bits);
        }
        return values()[(bits - 128) / 32];
    }

    /**
     * Looks up the size encoded by a mnemonic of {@code wordCount} words.
     *
     * @param wordCount number of words
     * @return the matching size
     * @throws InvalidMnemonicLengthException if {@code wordCount} is not 12, 15, 18, 21 or 24
     */
    public static EntropySize ofWordCount(final int wordCount) {
        if (wordCount % 3 != 0 || wordCount < 12 || wordCount > 24) {
            throw new InvalidMnemonicLengthException(wordCount);
        }
        return values()[(wordCount - 12) / 3];
    }
}
