// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.bip39;

import java.math.BigInteger;
import java.util.Objects;

import sh.wordseed.core.crypto.Sha256;
import sh.wordseed.primitives.UnsignedBytes;

/**
 * BIP-39 checksum: the first {@code entropyBits / 32} bits of SHA-256(entropy),
 * appended below the entropy's least significant bit.
 *
 * <p>
 * The checksummed value is handled as one unsigned big-endian integer of
 * {@code entropyBits + checksumBits} bits, always a multiple of 11.
 *
 * @since 0.1.0
 */
public final class Checksum {

    /** Every checksum fits in the first digest byte for entropy up to 32 bytes. */
    static final int MAX_ENTROPY_BYTES = 32;

    private Checksum() {
        // Utility class
    }

    /**
     * Number of checksum bits for entropy of the given byte length.
     *
     * @param entropyBytes entropy length in bytes
     * @return {@code entropyBytes * 8 / 32}
     */
    public static int checksumBits(final int entropyBytes) {
        return entropyBytes / 4;
    }

    /**
     * Appends the checksum bits to {@code entropy}.
     *
     * @param entropy entropy bytes, at most 32
     * @return the checksummed value as minimal unsigned big-endian bytes
     * @throws NullPointerException     if entropy is null
     * @throws IllegalArgumentException if entropy is longer than 32 bytes
     */
    public static byte[] appendChecksum(final byte[] entropy) {
        return UnsignedBytes.toMinimalBytes(checksummedValue(entropy));
    }

    /**
     * Appends the checksum bits to {@code entropy}, returning the combined integer.
     *
     * @param entropy entropy bytes, at most 32
     * @return {@code entropy << cs | sha256(entropy)[0] >>> (8 - cs)}
     */
    static BigInteger checksummedValue(final byte[] entropy) {
        Objects.requireNonNull(entropy, "entropy cannot be null");
        if (entropy.length > MAX_ENTROPY_BYTES) {
            throw new IllegalArgumentException(
                    "Checksum supports at most " + MAX_ENTROPY_BYTES + " bytes of entropy, got " + entropy.length);
        }

        final int firstHashByte = Sha256.hash(entropy)[0] & 0xFF;
        final int checksumBits = checksumBits(entropy.length);

        // Shift in one hash bit at a time, most significant first
        BigInteger value = UnsignedBytes.toBigInteger(entropy);
        for (int i = 0; i < checksumBits; i++) {
            value = value.shiftLeft(1);
            if ((firstHashByte & (1 << (7 - i))) != 0) {
                value = value.or(BigInteger.ONE);
            }
        }
        return value;
    }
}
