// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * PBKDF2 with HMAC-SHA512 (RFC 8018), backed by BouncyCastle's lightweight API.
 *
 * <p>
 * Works on raw password bytes; the caller decides the text encoding.
 *
 * @since 0.1.0
 */
public final class Pbkdf2 {

    private Pbkdf2() {
        // Utility class
    }

    /**
     * Derives {@code keyLengthBytes} bytes of key material.
     *
     * @param password       password bytes
     * @param salt           salt bytes
     * @param iterations     iteration count, at least 1
     * @param keyLengthBytes output length in bytes, at least 1
     * @return derived key
     * @throws NullPointerException     if password or salt is null
     * @throws IllegalArgumentException if iterations or keyLengthBytes is not positive
     */
    public static byte[] hmacSha512(
            final byte[] password, final byte[] salt, final int iterations, final int keyLengthBytes) {
        Objects.requireNonNull(password, "password cannot be null");
        Objects.requireNonNull(salt, "salt cannot be null");
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive, got " + iterations);
        }
        if (keyLengthBytes < 1) {
            throw new IllegalArgumentException("keyLengthBytes must be positive, got " + keyLengthBytes);
        }

        final PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA512Digest());
        generator.init(password, salt, iterations);
        final KeyParameter key = (KeyParameter) generator.generateDerivedParameters(keyLengthBytes * 8);
        return key.getKey();
    }
}
