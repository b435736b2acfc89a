// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.bip39;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Splits a checksummed-entropy integer into 11-bit word indices and joins them back.
 *
 * <p>
 * Index 0 is the most significant group. {@link #split} fills the array from the
 * end, taking the low 11 bits each round, so no reversal is needed.
 *
 * @since 0.1.0
 */
public final class BitPacker {

    public static final int BITS_PER_WORD = 11;

    static final int MAX_INDEX = (1 << BITS_PER_WORD) - 1;

    private static final BigInteger WORD_MASK = BigInteger.valueOf(MAX_INDEX);
    private static final BigInteger WORD_RADIX = BigInteger.valueOf(MAX_INDEX + 1L);

    private BitPacker() {
        // Utility class
    }

    /**
     * Splits {@code value} into {@code wordCount} 11-bit groups, most significant first.
     * Bits above {@code wordCount * 11} are ignored.
     *
     * @param value     non-negative integer to split
     * @param wordCount number of groups to produce
     * @return word indices in [0, 2047]
     * @throws IllegalArgumentException if value is negative or wordCount is negative
     */
    public static int[] split(final BigInteger value, final int wordCount) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative");
        }
        if (wordCount < 0) {
            throw new IllegalArgumentException("wordCount cannot be negative: " + wordCount);
        }

        final int[] indices = new int[wordCount];
        BigInteger remaining = value;
        for (int i = wordCount - 1; i >= 0; i--) {
            indices[i] = remaining.and(WORD_MASK).intValue();
            remaining = remaining.shiftRight(BITS_PER_WORD);
        }
        return indices;
    }

    /**
     * Joins 11-bit groups, most significant first, into one integer.
     *
     * @param indices word indices in [0, 2047]
     * @return the packed value
     * @throws IllegalArgumentException if any index is out of range
     */
    public static BigInteger join(final int[] indices) {
        Objects.requireNonNull(indices, "indices cannot be null");

        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < indices.length; i++) {
            final int index = indices[i];
            if (index < 0 || index > MAX_INDEX) {
                throw new IllegalArgumentException("Word index out of range at position " + i + ": " + index);
            }
            value = value.multiply(WORD_RADIX).add(BigInteger.valueOf(index));
        }
        return value;
    }
}
