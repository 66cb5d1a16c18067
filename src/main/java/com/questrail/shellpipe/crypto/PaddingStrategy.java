package com.questrail.shellpipe.crypto;

/**
 * PaddingStrategy
 * -----------------------------------------------------------------------------
 * Source of decoy padding for the plaintext envelope.
 *
 * <p>Each call returns a fresh, independently sized block of filler bytes. The
 * envelope asks for two blocks per encryption (prefix and suffix) so the
 * ciphertext length of identical payloads varies from bundle to bundle.</p>
 */
public interface PaddingStrategy
{
    /**
     * @return a newly allocated padding block; never null, possibly empty
     */
    byte[] nextPadding();
}
