// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.bip39;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.security.SecureRandom;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.wordseed.core.error.InvalidEntropyLengthException;
import sh.wordseed.core.error.RandomSourceException;

@ExtendWith(MockitoExtension.class)
class EntropyGeneratorTest {

    @Mock
    private SecureRandom random;

    @ParameterizedTest
    @ValueSource(ints = {128, 160, 192, 224, 256})
    void generatesRequestedLength(int bits) {
        assertEquals(bits / 8, EntropyGenerator.create().generate(bits).length);
    }

    @ParameterizedTest
    @EnumSource(EntropySize.class)
    void generatesForEverySize(EntropySize size) {
        assertEquals(size.bytes(), EntropyGenerator.create().generate(size).length);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 64, 96, 127, 129, 288, 512})
    void rejectsInvalidSizes(int bits) {
        InvalidEntropyLengthException e = assertThrows(InvalidEntropyLengthException.class,
                () -> EntropyGenerator.create().generate(bits));
        assertEquals(bits, e.bitLength());
    }

    @Test
    void successiveCallsDiffer() {
        EntropyGenerator generator = EntropyGenerator.create();

        assertFalse(Arrays.equals(generator.generate(256), generator.generate(256)));
    }

    @Test
    void drawsFromSuppliedSource() {
        doAnswer(invocation -> {
            byte[] out = invocation.getArgument(0);
            Arrays.fill(out, (byte) 0x5a);
            return null;
        }).when(random).nextBytes(any(byte[].class));

        byte[] entropy = new EntropyGenerator(random).generate(EntropySize.BITS_160);

        byte[] expected = new byte[20];
        Arrays.fill(expected, (byte) 0x5a);
        assertArrayEquals(expected, entropy);
        verify(random).nextBytes(any(byte[].class));
    }

    @Test
    void wrapsRandomSourceFailure() {
        IllegalStateException failure = new IllegalStateException("entropy pool exhausted");
        doThrow(failure).when(random).nextBytes(any(byte[].class));

        RandomSourceException e = assertThrows(RandomSourceException.class,
                () -> new EntropyGenerator(random).generate(128));

        assertSame(failure, e.getCause());
        assertTrue(e.getMessage().contains("16 bytes"));
    }

    @Test
    void rejectsNulls() {
        assertThrows(NullPointerException.class, () -> new EntropyGenerator(null));
        assertThrows(NullPointerException.class, () -> EntropyGenerator.create().generate(null));
    }
}
