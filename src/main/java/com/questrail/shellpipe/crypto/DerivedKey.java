package com.questrail.shellpipe.crypto;

import java.util.Arrays;
import java.util.Objects;

/**
 * DerivedKey
 * -----------------------------------------------------------------------------
 * Symmetric key material produced by a {@link KeyDerivation} together with the
 * salt it was derived from.
 *
 * <p>Instances are scoped to a single encrypt or decrypt call. The holder wipes
 * the key with {@link #destroy()} once the cipher has been initialised; nothing
 * in the relay caches a {@code DerivedKey}, because every bundle carries its own
 * salt.</p>
 */
public final class DerivedKey implements AutoCloseable
{
    private final byte[] key;
    private final byte[] salt;

    public DerivedKey(byte[] key, byte[] salt)
    {
        this.key = Objects.requireNonNull(key, "key").clone();
        this.salt = Objects.requireNonNull(salt, "salt").clone();
    }

    /**
     * @return a copy of the raw key bytes
     */
    public byte[] key()
    {
        return key.clone();
    }

    /**
     * @return a copy of the salt the key was derived from
     */
    public byte[] salt()
    {
        return salt.clone();
    }

    public int keyLength()
    {
        return key.length;
    }

    /**
     * Overwrites the key bytes with zeroes.
     */
    public void destroy()
    {
        Arrays.fill(key, (byte) 0);
    }

    @Override
    public void close()
    {
        destroy();
    }
}
