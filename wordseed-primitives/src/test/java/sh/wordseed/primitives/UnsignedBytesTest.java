// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.primitives;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link UnsignedBytes}.
 */
class UnsignedBytesTest {

    @Test
    void zeroEncodesToEmptyArray() {
        assertArrayEquals(new byte[0], UnsignedBytes.toMinimalBytes(BigInteger.ZERO));
    }

    @Test
    void dropsTwosComplementSignByte() {
        // 0x80 needs a sign byte in two's complement
        assertArrayEquals(new byte[] {(byte) 0x80}, UnsignedBytes.toMinimalBytes(BigInteger.valueOf(0x80)));
        assertArrayEquals(new byte[] {0x7f}, UnsignedBytes.toMinimalBytes(BigInteger.valueOf(0x7f)));
        assertArrayEquals(new byte[] {0x01, 0x00}, UnsignedBytes.toMinimalBytes(BigInteger.valueOf(256)));
    }

    @Test
    void rejectsNegativeAndNull() {
        assertThrows(IllegalArgumentException.class, () -> UnsignedBytes.toMinimalBytes(BigInteger.ONE.negate()));
        assertThrows(IllegalArgumentException.class, () -> UnsignedBytes.toMinimalBytes(null));
    }

    @Test
    void leftPadWidensWithZeros() {
        assertArrayEquals(new byte[] {0, 0, 0x12, 0x34}, UnsignedBytes.leftPad(new byte[] {0x12, 0x34}, 4));
        assertArrayEquals(new byte[] {0, 0}, UnsignedBytes.leftPad(new byte[0], 2));
    }

    @Test
    void leftPadNeverTruncates() {
        byte[] input = new byte[] {1, 2, 3};
        byte[] result = UnsignedBytes.leftPad(input, 2);

        assertArrayEquals(input, result);
        assertNotSame(input, result);
    }

    @Test
    void leftPadRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> UnsignedBytes.leftPad(null, 2));
        assertThrows(IllegalArgumentException.class, () -> UnsignedBytes.leftPad(new byte[0], -1));
    }

    @Test
    void toBytesPadsTheMinimalForm() {
        assertArrayEquals(new byte[] {0, 0, 0, (byte) 0xff}, UnsignedBytes.toBytes(BigInteger.valueOf(255), 4));
        assertArrayEquals(new byte[16], UnsignedBytes.toBytes(BigInteger.ZERO, 16));
    }

    @Test
    void toBigIntegerIsUnsigned() {
        assertEquals(BigInteger.valueOf(0xffff), UnsignedBytes.toBigInteger(new byte[] {(byte) 0xff, (byte) 0xff}));
        assertEquals(BigInteger.ZERO, UnsignedBytes.toBigInteger(new byte[0]));
    }
}
