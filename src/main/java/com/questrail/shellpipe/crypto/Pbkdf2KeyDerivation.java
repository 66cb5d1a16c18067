package com.questrail.shellpipe.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * PBKDF2 {@link KeyDerivation} backed by the JCA {@link SecretKeyFactory}.
 *
 * <p>Thread-safe. The factory is obtained per thread because JCA factories are
 * not guaranteed to be safe for concurrent use, and the two pumps of a session
 * derive keys concurrently.</p>
 */
public final class Pbkdf2KeyDerivation implements KeyDerivation
{
    private final KeyDerivationPolicy policy;
    private final SecureRandom random;
    private final ThreadLocal<SecretKeyFactory> factory;

    public Pbkdf2KeyDerivation()
    {
        this(KeyDerivationPolicy.defaults(), new SecureRandom());
    }

    public Pbkdf2KeyDerivation(KeyDerivationPolicy policy, SecureRandom random)
    {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.random = Objects.requireNonNull(random, "random");
        this.factory = ThreadLocal.withInitial(() -> initFactory(policy.algorithm()));
        // Unknown algorithm fails here, not on the first relayed unit.
        factory.get();
    }

    @Override
    public DerivedKey derive(String passphrase)
    {
        byte[] salt = new byte[policy.saltLengthBytes()];
        random.nextBytes(salt);
        return derive(passphrase, salt);
    }

    @Override
    public DerivedKey derive(String passphrase, byte[] salt)
    {
        if (passphrase == null) {
            throw new IllegalArgumentException("passphrase must not be null");
        }
        Objects.requireNonNull(salt, "salt");

        char[] chars = passphrase.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(chars, salt, policy.iterations(), policy.keyLengthBytes() * 8);
        byte[] key = null;
        try {
            key = factory.get().generateSecret(spec).getEncoded();
            return new DerivedKey(key, salt);
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 derivation failed", e);
        }
        finally {
            spec.clearPassword();
            Arrays.fill(chars, '\0');
            if (key != null) {
                Arrays.fill(key, (byte) 0);
            }
        }
    }

    private static SecretKeyFactory initFactory(String algorithm)
    {
        try {
            return SecretKeyFactory.getInstance(algorithm);
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("Key derivation algorithm unavailable: " + algorithm, e);
        }
    }
}
