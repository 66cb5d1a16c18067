package com.questrail.shellpipe.crypto;

/**
 * KeyDerivation
 * -----------------------------------------------------------------------------
 * Turns a shared passphrase and a salt into a symmetric key.
 *
 * <p>Implementations MUST be deterministic: the same passphrase and salt always
 * yield bit-identical key bytes. The receiver of a bundle relies on this to
 * rebuild the sender's key from the salt embedded in the bundle.</p>
 */
public interface KeyDerivation
{
    /**
     * Derive a key using a freshly generated random salt.
     *
     * @param passphrase shared passphrase (may be empty, must not be null)
     * @return the derived key and the salt that was generated for it
     */
    DerivedKey derive(String passphrase);

    /**
     * Derive a key from an explicitly supplied salt.
     *
     * @param passphrase shared passphrase (may be empty, must not be null)
     * @param salt salt taken from an incoming bundle
     * @return the derived key and a copy of {@code salt}
     */
    DerivedKey derive(String passphrase, byte[] salt);
}
