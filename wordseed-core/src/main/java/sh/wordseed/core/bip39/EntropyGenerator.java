// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.bip39;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Objects;

import sh.wordseed.core.error.InvalidEntropyLengthException;
import sh.wordseed.core.error.RandomSourceException;

/**
 * Produces fresh entropy of a valid BIP-39 size from a {@link SecureRandom}.
 *
 * <p>
 * Instances are thread-safe as long as the wrapped {@link SecureRandom} is, which
 * holds for the JDK implementations.
 *
 * @since 0.1.0
 */
public final class EntropyGenerator {

    private final SecureRandom random;

    /**
     * @param random the random source to draw from
     */
    public EntropyGenerator(final SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * Creates a generator over the platform's default {@link SecureRandom}.
     *
     * @return a new generator
     */
    public static EntropyGenerator create() {
        return new EntropyGenerator(new SecureRandom());
    }

    /**
     * Creates a generator over {@link SecureRandom#getInstanceStrong()}. The strong
     * source may block on some platforms while the OS gathers entropy.
     *
     * @return a new generator
     * @throws RandomSourceException if no strong source is configured
     */
    public static EntropyGenerator strong() {
        try {
            return new EntropyGenerator(SecureRandom.getInstanceStrong());
        } catch (NoSuchAlgorithmException e) {
            throw new RandomSourceException("No strong SecureRandom algorithm available", e);
        }
    }

    /**
     * Generates {@code bitSize / 8} random bytes.
     *
     * @param bitSize 128, 160, 192, 224 or 256
     * @return fresh entropy
     * @throws InvalidEntropyLengthException if bitSize is not a valid size
     * @throws RandomSourceException         if the random source fails
     */
    public byte[] generate(final int bitSize) {
        return generate(EntropySize.ofBits(bitSize));
    }

    /**
     * Generates entropy of the given size.
     *
     * @param size entropy size
     * @return fresh entropy
     * @throws RandomSourceException if the random source fails
     */
    public byte[] generate(final EntropySize size) {
        Objects.requireNonNull(size, "size cannot be null");
        final byte[] entropy = new byte[size.bytes()];
        try {
            random.nextBytes(entropy);
        } catch (RuntimeException e) {
            throw new RandomSourceException(
                    "Secure random source failed to supply " + entropy.length + " bytes", e);
        }
        return entropy;
    }
}
