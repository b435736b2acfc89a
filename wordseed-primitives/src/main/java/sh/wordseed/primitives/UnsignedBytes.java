// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.primitives;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Conversions between non-negative {@link BigInteger} values and their unsigned
 * big-endian byte form.
 *
 * <ul>
 * <li>{@link #toMinimalBytes(BigInteger)} never emits the leading sign byte that
 * {@link BigInteger#toByteArray()} adds, and returns an empty array for zero.</li>
 * <li>{@link #leftPad(byte[], int)} widens to a fixed size and never truncates.</li>
 * </ul>
 */
public final class UnsignedBytes {

    private static final byte[] EMPTY = new byte[0];

    private UnsignedBytes() {
        // Utility class
    }

    /**
     * Encodes a non-negative value as minimal unsigned big-endian bytes.
     *
     * @param value the value to encode
     * @return minimal magnitude bytes, empty for zero
     * @throws IllegalArgumentException if {@code value} is null or negative
     */
    public static byte[] toMinimalBytes(final BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative: " + value);
        }
        if (value.signum() == 0) {
            return EMPTY;
        }

        // toByteArray() is two's complement; a positive value whose top bit is set
        // gets an extra 0x00 in front.
        final byte[] twosComp = value.toByteArray();
        if (twosComp[0] == 0) {
            return Arrays.copyOfRange(twosComp, 1, twosComp.length);
        }
        return twosComp;
    }

    /**
     * Encodes a non-negative value as unsigned big-endian bytes, left padded with
     * zeros to at least {@code length} bytes.
     *
     * @param value  the value to encode
     * @param length the minimum width in bytes
     * @return the padded bytes
     */
    public static byte[] toBytes(final BigInteger value, final int length) {
        return leftPad(toMinimalBytes(value), length);
    }

    /**
     * Returns {@code bytes} left padded with zeros to {@code length}. Inputs that are
     * already at least {@code length} long are returned as a copy, unchanged.
     *
     * @param bytes  the bytes to pad
     * @param length the minimum width in bytes
     * @return a new array of {@code max(bytes.length, length)} bytes
     * @throws IllegalArgumentException if {@code bytes} is null or {@code length} is negative
     */
    public static byte[] leftPad(final byte[] bytes, final int length) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length cannot be negative: " + length);
        }
        if (bytes.length >= length) {
            return bytes.clone();
        }
        final byte[] padded = new byte[length];
        System.arraycopy(bytes, 0, padded, length - bytes.length, bytes.length);
        return padded;
    }

    /**
     * Interprets {@code bytes} as an unsigned big-endian integer.
     *
     * @param bytes the magnitude bytes, may be empty
     * @return the non-negative value
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static BigInteger toBigInteger(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        return new BigInteger(1, bytes);
    }
}
