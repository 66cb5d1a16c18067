/**
 * Concrete sealed-channel codec: AES-GCM over a Jackson JSON envelope and
 * bundle.
 *
 * <p>The encrypt path is {@code payload → EncryptedPacket → JSON bytes →
 * AES-GCM → EncryptedBundle → JSON line}. Decrypt runs the same steps in
 * reverse and rejects a bundle before touching the envelope if its nonce or
 * tag has the wrong size.</p>
 */
package com.questrail.shellpipe.codec.impl;
