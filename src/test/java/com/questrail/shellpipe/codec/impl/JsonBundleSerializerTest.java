package com.questrail.shellpipe.codec.impl;

import com.questrail.shellpipe.codec.BundleDecodeException;
import com.questrail.shellpipe.model.EncryptedBundle;
import com.questrail.shellpipe.model.EncryptedPacket;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Field tags and Base64 rendering are what a peer on the other end parses,
 * so they are pinned here literally.
 */
final class JsonBundleSerializerTest
{
    private final JsonBundleSerializer serializer = new JsonBundleSerializer();

    @Test
    void bundleUsesTaggedBase64Fields()
    {
        EncryptedBundle bundle = new EncryptedBundle(
                new byte[] { 1, 2, 3 }, new byte[] { 4, 5, 6 }, new byte[] { 7, 8, 9 }, new byte[] { 10, 11, 12 });

        String json = serializer.writeBundle(bundle);

        assertEquals("{\"Data\":\"AQID\",\"Nonce\":\"BAUG\",\"Tag\":\"BwgJ\",\"Salt\":\"CgsM\"}", json);
    }

    @Test
    void readsBundleWrittenByPeer()
    {
        EncryptedBundle bundle = serializer.readBundle(
                "{\"Salt\":\"CgsM\",\"Tag\":\"BwgJ\",\"Nonce\":\"BAUG\",\"Data\":\"AQID\"}");

        assertArrayEquals(new byte[] { 1, 2, 3 }, bundle.ciphertext());
        assertArrayEquals(new byte[] { 4, 5, 6 }, bundle.nonce());
        assertArrayEquals(new byte[] { 7, 8, 9 }, bundle.tag());
        assertArrayEquals(new byte[] { 10, 11, 12 }, bundle.salt());
    }

    @Test
    void packetUsesDummyFieldsAroundData()
    {
        EncryptedPacket packet = new EncryptedPacket(
                new byte[] { 1 }, "hi".getBytes(StandardCharsets.US_ASCII), new byte[] { 2 });

        String json = new String(serializer.writePacket(packet), StandardCharsets.UTF_8);

        assertEquals("{\"Dummy1\":\"AQ==\",\"Data\":\"aGk=\",\"Dummy2\":\"Ag==\"}", json);
        assertEquals(packet, serializer.readPacket(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void malformedRecordsAreDecodeFailures()
    {
        assertThrows(BundleDecodeException.class, () -> serializer.readBundle(""));
        assertThrows(BundleDecodeException.class, () -> serializer.readBundle("   "));
        assertThrows(BundleDecodeException.class, () -> serializer.readBundle("null"));
        assertThrows(BundleDecodeException.class, () -> serializer.readBundle("not json"));
        assertThrows(BundleDecodeException.class, () -> serializer.readBundle("{\"Data\":\"AQID\"}"));
        assertThrows(BundleDecodeException.class, () -> serializer.readBundle("{\"Data\":\"@@@\",\"Nonce\":\"AQID\",\"Tag\":\"AQID\",\"Salt\":\"AQID\"}"));
    }

    @Test
    void malformedEnvelopeIsDecodeFailure()
    {
        assertThrows(BundleDecodeException.class,
                () -> serializer.readPacket("whoami".getBytes(StandardCharsets.US_ASCII)));
        assertThrows(BundleDecodeException.class,
                () -> serializer.readPacket("null".getBytes(StandardCharsets.US_ASCII)));
    }
}
