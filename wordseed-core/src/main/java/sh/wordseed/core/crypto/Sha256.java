// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wordseed.core.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 hashing utility.
 *
 * <p>
 * Thin wrapper over the JCA SHA-256 implementation. The mnemonic checksum is the
 * leading bits of this digest, and wordlist tables are pinned by it.
 *
 * <h2>ThreadLocal Memory Management</h2>
 *
 * <p>
 * Digest instances are cached per thread. In thread pool environments where the
 * library may be redeployed (servlet containers, application servers), call
 * {@link #cleanup()} when a pooled thread is returned to avoid classloader leaks.
 * Short-lived processes do not need to.
 *
 * @since 0.1.0
 */
public final class Sha256 {

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by the Java platform
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    });

    private Sha256() {
        // Utility class
    }

    /**
     * Computes the SHA-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Removes the cached digest instance from the current thread.
     *
     * @see ThreadLocal#remove()
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
