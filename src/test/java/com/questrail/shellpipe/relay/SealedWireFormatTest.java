package com.questrail.shellpipe.relay;

import com.questrail.shellpipe.codec.PacketCodec;
import com.questrail.shellpipe.codec.impl.AesGcmPacketCodec;
import com.questrail.shellpipe.crypto.Pbkdf2KeyDerivation;
import com.questrail.shellpipe.crypto.UniformPaddingStrategy;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class SealedWireFormatTest {

    private final PacketCodec codec = new AesGcmPacketCodec(new Pbkdf2KeyDerivation(), new UniformPaddingStrategy(0, 16));
    private final SealedWireFormat wire = new SealedWireFormat(codec, "secret1", 4096);

    @Test
    void eachUnitBecomesOneLine() throws Exception {
        ByteArrayOutputStream transport = new ByteArrayOutputStream();
        UnitSink sink = wire.sink(transport);

        sink.write(bytes("first\n"));
        sink.write(bytes("second"));

        String[] lines = transport.toString(StandardCharsets.US_ASCII).split("\n", -1);
        assertEquals(3, lines.length);
        assertEquals("", lines[2]);
        assertArrayEquals(bytes("first\n"), codec.decrypt(lines[0], "secret1"));
        assertArrayEquals(bytes("second"), codec.decrypt(lines[1], "secret1"));
    }

    @Test
    void sourceOpensWhatSinkSealed() throws Exception {
        ByteArrayOutputStream transport = new ByteArrayOutputStream();
        UnitSink sink = wire.sink(transport);
        sink.write(bytes("whoami\n"));
        sink.write(bytes("exit\n"));

        UnitSource source = wire.source(new ByteArrayInputStream(transport.toByteArray()));

        assertArrayEquals(bytes("whoami\n"), source.next().orElseThrow());
        assertArrayEquals(bytes("exit\n"), source.next().orElseThrow());
        assertEquals(Optional.empty(), source.next());
        assertEquals(0, source.droppedUnits());
    }

    @Test
    void unreadableLinesAreDroppedSilentlyAndCounted() throws Exception {
        String valid = codec.encrypt(bytes("ok\n"), "secret1");
        String wrongKey = codec.encrypt(bytes("nope\n"), "other");
        String input = "garbage\n" + wrongKey + "\n" + valid + "\n";

        UnitSource source = wire.source(new ByteArrayInputStream(bytes(input)));

        assertEquals(0, source.next().orElseThrow().length);
        assertEquals(0, source.next().orElseThrow().length);
        assertArrayEquals(bytes("ok\n"), source.next().orElseThrow());
        assertEquals(Optional.empty(), source.next());
        assertEquals(2, source.droppedUnits());
    }

    @Test
    void oversizedLineIsSkippedUpToItsTerminator() throws Exception {
        String valid = codec.encrypt(bytes("after\n"), "secret1");
        String input = "A".repeat(10_000) + "\n" + valid + "\n";

        UnitSource source = wire.source(new ByteArrayInputStream(bytes(input)));

        assertEquals(0, source.next().orElseThrow().length);
        assertArrayEquals(bytes("after\n"), source.next().orElseThrow());
        assertEquals(1, source.droppedUnits());
    }

    @Test
    void blankLinesAndCrLfAreTolerated() throws Exception {
        String valid = codec.encrypt(bytes("dir\n"), "secret1");
        String input = "\r\n\n" + valid + "\r\n";

        UnitSource source = wire.source(new ByteArrayInputStream(bytes(input)));

        assertEquals(0, source.next().orElseThrow().length);
        assertEquals(0, source.next().orElseThrow().length);
        assertArrayEquals(bytes("dir\n"), source.next().orElseThrow());
        assertEquals(0, source.droppedUnits());
    }

    @Test
    void finalLineWithoutTerminatorIsStillDelivered() throws Exception {
        String valid = codec.encrypt(bytes("last"), "secret1");

        UnitSource source = wire.source(new ByteArrayInputStream(bytes(valid)));

        assertArrayEquals(bytes("last"), source.next().orElseThrow());
        assertEquals(Optional.empty(), source.next());
    }

    @Test
    void reportsSealed() {
        assertTrue(wire.isSealed());
        assertFalse(new PlainWireFormat().isSealed());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
