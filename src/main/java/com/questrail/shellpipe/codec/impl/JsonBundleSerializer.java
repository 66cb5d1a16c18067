package com.questrail.shellpipe.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.shellpipe.codec.BundleDecodeException;
import com.questrail.shellpipe.model.EncryptedBundle;
import com.questrail.shellpipe.model.EncryptedPacket;

import java.io.IOException;
import java.util.Objects;

/**
 * JsonBundleSerializer
 * -----------------------------------------------------------------------------
 * Field-tagged JSON rendering of {@link EncryptedBundle} and
 * {@link EncryptedPacket}. Byte arrays are written as Base64 strings, so a
 * serialized bundle is plain ASCII without line breaks.
 *
 * <p>Parsing failures of any kind (syntax, missing field, {@code null}
 * document) surface as {@link BundleDecodeException}.</p>
 */
public final class JsonBundleSerializer
{
    private final ObjectMapper mapper;

    public JsonBundleSerializer()
    {
        this(new ObjectMapper());
    }

    public JsonBundleSerializer(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String writeBundle(EncryptedBundle bundle)
    {
        Objects.requireNonNull(bundle, "bundle");
        try {
            return mapper.writeValueAsString(bundle);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("EncryptedBundle is not serializable", e);
        }
    }

    public EncryptedBundle readBundle(String text)
    {
        if (text == null || text.isBlank()) {
            throw new BundleDecodeException("Empty bundle record");
        }
        try {
            EncryptedBundle bundle = mapper.readValue(text, EncryptedBundle.class);
            if (bundle == null) {
                throw new BundleDecodeException("Bundle record is JSON null");
            }
            return bundle;
        }
        catch (JsonProcessingException e) {
            throw new BundleDecodeException("Malformed bundle record", e);
        }
    }

    public byte[] writePacket(EncryptedPacket packet)
    {
        Objects.requireNonNull(packet, "packet");
        try {
            return mapper.writeValueAsBytes(packet);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("EncryptedPacket is not serializable", e);
        }
    }

    public EncryptedPacket readPacket(byte[] plaintext)
    {
        Objects.requireNonNull(plaintext, "plaintext");
        try {
            EncryptedPacket packet = mapper.readValue(plaintext, EncryptedPacket.class);
            if (packet == null) {
                throw new BundleDecodeException("Envelope is JSON null");
            }
            return packet;
        }
        catch (IOException e) {
            throw new BundleDecodeException("Malformed envelope", e);
        }
    }
}
