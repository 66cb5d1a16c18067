package com.questrail.shellpipe.codec;

/**
 * Indicates that AEAD authentication of a bundle failed: wrong passphrase,
 * corrupted or tampered ciphertext, or a tag that does not match the nonce.
 */
public final class BundleDecryptException extends PacketCodecException
{
    public BundleDecryptException(String message, Throwable cause) {
        super(message, cause);
    }
}
