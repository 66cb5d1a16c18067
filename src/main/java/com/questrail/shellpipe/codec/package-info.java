/**
 * Sealed Channel Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> of the sealed
 * channel: the contract that turns an application payload into one line of
 * transport text and back.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] payload
 *        → EncryptedPacket          (decoy prefix, payload, decoy suffix)
 *            → AES-GCM              (key derived per bundle from passphrase + salt)
 *                → EncryptedBundle  (ciphertext, nonce, tag, salt)
 *                    → one line of text on the transport
 * </pre>
 *
 * <h2>Failure classification</h2>
 * <ul>
 *   <li>{@link com.questrail.shellpipe.codec.BundleDecodeException}: structure</li>
 *   <li>{@link com.questrail.shellpipe.codec.BundleDecryptException}: authentication</li>
 * </ul>
 *
 * <p>Callers in the relay treat both the same way: the unit is dropped without
 * any visible output, so a remote peer learns nothing about why a record was
 * rejected.</p>
 */
package com.questrail.shellpipe.codec;
