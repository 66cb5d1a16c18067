package com.questrail.shellpipe.codec.impl;

import com.questrail.shellpipe.codec.BundleDecodeException;
import com.questrail.shellpipe.codec.BundleDecryptException;
import com.questrail.shellpipe.codec.PacketCodec;
import com.questrail.shellpipe.crypto.DerivedKey;
import com.questrail.shellpipe.crypto.KeyDerivation;
import com.questrail.shellpipe.crypto.PaddingStrategy;
import com.questrail.shellpipe.crypto.Pbkdf2KeyDerivation;
import com.questrail.shellpipe.crypto.UniformPaddingStrategy;
import com.questrail.shellpipe.model.EncryptedBundle;
import com.questrail.shellpipe.model.EncryptedPacket;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AesGcmPacketCodec
 * -----------------------------------------------------------------------------
 * {@link PacketCodec} sealing envelopes with AES-GCM (96-bit nonce, 128-bit tag,
 * no associated data).
 *
 * <p>Every call derives its own key. Nothing key-related outlives the call:
 * the {@link DerivedKey} and the raw key copy handed to the cipher are wiped
 * before returning.</p>
 *
 * <p>The JCA appends the GCM tag to the ciphertext. The codec splits it off
 * into {@link EncryptedBundle#tag()} on the way out and re-joins it on the
 * way in.</p>
 */
public final class AesGcmPacketCodec implements PacketCodec
{
    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final KeyDerivation keyDerivation;
    private final PaddingStrategy padding;
    private final SecureRandom random;
    private final JsonBundleSerializer serializer;
    private final ThreadLocal<Cipher> cipher = ThreadLocal.withInitial(AesGcmPacketCodec::initCipher);

    public AesGcmPacketCodec()
    {
        this(new Pbkdf2KeyDerivation(), new UniformPaddingStrategy(), new SecureRandom(), new JsonBundleSerializer());
    }

    public AesGcmPacketCodec(KeyDerivation keyDerivation, PaddingStrategy padding)
    {
        this(keyDerivation, padding, new SecureRandom(), new JsonBundleSerializer());
    }

    public AesGcmPacketCodec(KeyDerivation keyDerivation,
                             PaddingStrategy padding,
                             SecureRandom random,
                             JsonBundleSerializer serializer)
    {
        this.keyDerivation = Objects.requireNonNull(keyDerivation, "keyDerivation");
        this.padding = Objects.requireNonNull(padding, "padding");
        this.random = Objects.requireNonNull(random, "random");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    @Override
    public String encrypt(byte[] payload, String passphrase)
    {
        Objects.requireNonNull(payload, "payload");

        try (DerivedKey derived = keyDerivation.derive(passphrase)) {
            // Prefix and suffix lengths are drawn independently.
            EncryptedPacket packet = new EncryptedPacket(padding.nextPadding(), payload, padding.nextPadding());
            byte[] plaintext = serializer.writePacket(packet);

            byte[] nonce = new byte[NONCE_LENGTH];
            random.nextBytes(nonce);

            byte[] sealed = run(Cipher.ENCRYPT_MODE, derived, nonce, plaintext);
            int ctLength = sealed.length - TAG_LENGTH;

            EncryptedBundle bundle = new EncryptedBundle(
                    Arrays.copyOfRange(sealed, 0, ctLength),
                    nonce,
                    Arrays.copyOfRange(sealed, ctLength, sealed.length),
                    derived.salt());
            return serializer.writeBundle(bundle);
        }
        catch (AEADBadTagException e) {
            throw new IllegalStateException("AEAD tag failure while encrypting", e);
        }
    }

    @Override
    public byte[] decrypt(String text, String passphrase)
    {
        // 1) Structure
        EncryptedBundle bundle = serializer.readBundle(text);
        byte[] nonce = bundle.nonce();
        byte[] tag = bundle.tag();
        byte[] salt = bundle.salt();
        if (nonce.length != NONCE_LENGTH) {
            throw new BundleDecodeException("Unexpected nonce length " + nonce.length);
        }
        if (tag.length != TAG_LENGTH) {
            throw new BundleDecodeException("Unexpected tag length " + tag.length);
        }
        if (salt.length == 0) {
            throw new BundleDecodeException("Bundle carries no salt");
        }

        byte[] ciphertext = bundle.ciphertext();
        byte[] joined = new byte[ciphertext.length + TAG_LENGTH];
        System.arraycopy(ciphertext, 0, joined, 0, ciphertext.length);
        System.arraycopy(tag, 0, joined, ciphertext.length, TAG_LENGTH);

        // 2) Key from the bundle's salt, 3) authenticate + decrypt
        final byte[] plaintext;
        try (DerivedKey derived = keyDerivation.derive(passphrase, salt)) {
            plaintext = run(Cipher.DECRYPT_MODE, derived, nonce, joined);
        }
        catch (AEADBadTagException e) {
            throw new BundleDecryptException("Bundle failed authentication", e);
        }

        // 4) Envelope; decoys are dropped here
        return serializer.readPacket(plaintext).payload();
    }

    private byte[] run(int mode, DerivedKey derived, byte[] nonce, byte[] input)
            throws AEADBadTagException
    {
        byte[] key = derived.key();
        try {
            Cipher c = cipher.get();
            c.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            return c.doFinal(input);
        }
        catch (AEADBadTagException e) {
            throw e;
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM operation failed", e);
        }
        finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    private static Cipher initCipher()
    {
        try {
            return Cipher.getInstance(TRANSFORMATION);
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM unavailable", e);
        }
    }
}
