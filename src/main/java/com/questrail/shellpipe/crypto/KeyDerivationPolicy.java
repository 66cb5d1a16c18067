package com.questrail.shellpipe.crypto;

import java.util.Objects;

/**
 * KeyDerivationPolicy
 * -----------------------------------------------------------------------------
 * Parameters of the password-based key derivation.
 *
 * <p>Every relayed unit pays for one derivation with these parameters, and
 * both peers must use the same values.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>algorithm</b>: JCA {@code SecretKeyFactory} name. Defaults to
 *       {@code PBKDF2WithHmacSHA1}, the PRF existing peers use.</li>
 *   <li><b>iterations</b>: PBKDF2 iteration count (default 1000).</li>
 *   <li><b>keyLengthBytes</b>: derived key length (default 32, AES-256).</li>
 *   <li><b>saltLengthBytes</b>: length of generated salts (default 32).</li>
 * </ul>
 */
public record KeyDerivationPolicy(
        String algorithm,
        int iterations,
        int keyLengthBytes,
        int saltLengthBytes
) {
    public static final String DEFAULT_ALGORITHM = "PBKDF2WithHmacSHA1";
    public static final int DEFAULT_ITERATIONS = 1000;
    public static final int DEFAULT_KEY_LENGTH = 32;
    public static final int DEFAULT_SALT_LENGTH = 32;

    public KeyDerivationPolicy {
        Objects.requireNonNull(algorithm, "algorithm");
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        if (keyLengthBytes != 16 && keyLengthBytes != 24 && keyLengthBytes != 32) {
            throw new IllegalArgumentException("keyLengthBytes must be 16, 24 or 32");
        }
        if (saltLengthBytes < 8) {
            throw new IllegalArgumentException("saltLengthBytes must be at least 8");
        }
    }

    public static KeyDerivationPolicy defaults() {
        return new KeyDerivationPolicy(DEFAULT_ALGORITHM, DEFAULT_ITERATIONS, DEFAULT_KEY_LENGTH, DEFAULT_SALT_LENGTH);
    }

    public KeyDerivationPolicy withIterations(int iterations) {
        return new KeyDerivationPolicy(algorithm, iterations, keyLengthBytes, saltLengthBytes);
    }
}
