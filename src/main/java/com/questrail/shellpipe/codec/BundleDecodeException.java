package com.questrail.shellpipe.codec;

/**
 * Indicates that a bundle, or the envelope recovered from it, could not be
 * parsed.
 *
 * This typically reflects:
 * <ul>
 *   <li>A transport record that is not a serialized bundle at all</li>
 *   <li>Missing fields or fields of the wrong size (nonce, tag, salt)</li>
 *   <li>An authenticated plaintext that is not a valid envelope</li>
 * </ul>
 */
public final class BundleDecodeException extends PacketCodecException
{
    public BundleDecodeException(String message) {
        super(message);
    }

    public BundleDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
