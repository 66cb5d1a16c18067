package com.questrail.shellpipe.codec;

/**
 * PacketCodec
 * -----------------------------------------------------------------------------
 * Seals application payloads into self-describing, line-safe bundles and opens
 * them again.
 *
 * <p>The outbound direction performs, in order:</p>
 * <ol>
 *   <li>key derivation with a fresh salt</li>
 *   <li>decoy padding generation (prefix and suffix, independently sized)</li>
 *   <li>envelope serialization</li>
 *   <li>AEAD encryption under a fresh nonce</li>
 *   <li>bundle serialization into a single line of text</li>
 * </ol>
 *
 * <p>The inbound direction reverses these steps. Failures are classified as
 * either a {@link BundleDecodeException} (the bytes do not have the expected
 * structure) or a {@link BundleDecryptException} (authentication failed). The
 * codec never returns a payload that did not pass authentication.</p>
 *
 * <p>No key material is retained between calls. The passphrase is supplied per
 * call and every bundle carries its own salt.</p>
 */
public interface PacketCodec
{
    /**
     * Seal a payload.
     *
     * @param payload application bytes; may be empty
     * @param passphrase shared passphrase
     * @return serialized bundle; never contains {@code '\r'} or {@code '\n'}
     */
    String encrypt(byte[] payload, String passphrase);

    /**
     * Open a serialized bundle.
     *
     * @param bundle serialized bundle as produced by {@link #encrypt(byte[], String)}
     * @param passphrase shared passphrase
     * @return the payload, decoy padding removed
     * @throws BundleDecodeException if the bundle or the decrypted envelope is malformed
     * @throws BundleDecryptException if authentication of the ciphertext fails
     */
    byte[] decrypt(String bundle, String passphrase);
}
