// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.error;

/**
 * Thrown when supplied or requested entropy is not 128, 160, 192, 224 or 256 bits.
 *
 * @since 0.1.0
 */
public final class InvalidEntropyLengthException extends WordseedException {

    private final int bitLength;

    public InvalidEntropyLengthException(final int bitLength) {
        super("Entropy length must be 128, 160, 192, 224 or 256 bits, got " + bitLength);
        this.bitLength = bitLength;
    }

    /**
     * @return the rejected length in bits
     */
    public int bitLength() {
        return bitLength;
    }
}
