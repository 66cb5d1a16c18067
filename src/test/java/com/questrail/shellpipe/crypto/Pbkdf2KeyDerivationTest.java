package com.questrail.shellpipe.crypto;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class Pbkdf2KeyDerivationTest
{
    private final Pbkdf2KeyDerivation kdf = new Pbkdf2KeyDerivation();

    @Test
    void defaultsProduce32ByteKeyAndSalt()
    {
        try (DerivedKey key = kdf.derive("secret1")) {
            assertEquals(32, key.keyLength());
            assertEquals(32, key.salt().length);
        }
    }

    @Test
    void sameSaltAndPassphraseGiveSameKey()
    {
        byte[] salt = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII);
        try (DerivedKey a = kdf.derive("secret1", salt);
             DerivedKey b = kdf.derive("secret1", salt)) {
            assertArrayEquals(a.key(), b.key());
            assertArrayEquals(salt, a.salt());
        }
    }

    @Test
    void freshSaltPerCall()
    {
        try (DerivedKey a = kdf.derive("secret1");
             DerivedKey b = kdf.derive("secret1")) {
            assertFalse(Arrays.equals(a.salt(), b.salt()));
            assertFalse(Arrays.equals(a.key(), b.key()));
        }
    }

    @Test
    void differentPassphraseGivesDifferentKey()
    {
        byte[] salt = new byte[32];
        new SecureRandom().nextBytes(salt);
        try (DerivedKey a = kdf.derive("secret1", salt);
             DerivedKey b = kdf.derive("secret2", salt)) {
            assertFalse(Arrays.equals(a.key(), b.key()));
        }
    }

    @Test
    void matchesKnownPbkdf2HmacSha1Vector()
    {
        // RFC 6070 test vector: "password" / "salt", 2 iterations, 20 bytes.
        // Our key lengths are AES sizes, so compare the first 16 bytes of a 16-byte key.
        Pbkdf2KeyDerivation twoRounds = new Pbkdf2KeyDerivation(
                new KeyDerivationPolicy("PBKDF2WithHmacSHA1", 2, 16, 8), new SecureRandom());
        byte[] expected = {
                (byte) 0xea, 0x6c, 0x01, 0x4d, (byte) 0xc7, 0x2d, 0x6f, (byte) 0x8c,
                (byte) 0xcd, 0x1e, (byte) 0xd9, 0x2a, (byte) 0xce, 0x1d, 0x41, (byte) 0xf0
        };
        try (DerivedKey key = twoRounds.derive("password", "salt".getBytes(StandardCharsets.US_ASCII))) {
            assertArrayEquals(expected, key.key());
        }
    }

    @Test
    void nullPassphraseIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> kdf.derive(null));
        assertThrows(IllegalArgumentException.class, () -> kdf.derive(null, new byte[32]));
    }

    @Test
    void destroyWipesKeyMaterial()
    {
        DerivedKey key = kdf.derive("secret1");
        key.destroy();
        assertArrayEquals(new byte[32], key.key());
    }

    @Test
    void unknownAlgorithmFailsAtConstruction()
    {
        KeyDerivationPolicy policy = new KeyDerivationPolicy("PBKDF2WithNothing", 1000, 32, 32);
        assertThrows(IllegalStateException.class, () -> new Pbkdf2KeyDerivation(policy, new SecureRandom()));
    }

    @Test
    void policyRejectsNonAesKeyLengths()
    {
        assertThrows(IllegalArgumentException.class, () -> new KeyDerivationPolicy("PBKDF2WithHmacSHA1", 1000, 20, 32));
        assertThrows(IllegalArgumentException.class, () -> new KeyDerivationPolicy("PBKDF2WithHmacSHA1", 0, 32, 32));
        assertThrows(IllegalArgumentException.class, () -> new KeyDerivationPolicy("PBKDF2WithHmacSHA1", 1000, 32, 4));
    }
}
