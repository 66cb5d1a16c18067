package com.questrail.shellpipe.relay;

import com.questrail.shellpipe.codec.PacketCodec;
import com.questrail.shellpipe.codec.PacketCodecException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * SealedWireFormat
 * =============================================================================
 * Encrypted mode: every unit is sealed into its own bundle and written as one
 * newline-terminated line.
 *
 * <h2>Inbound failures are silent</h2>
 * A line that does not decode, fails authentication or exceeds
 * {@code maxRecordLength} is dropped: the source yields an empty unit and the
 * pump continues. Nothing is echoed to the peer or to the local display, so a
 * remote sender cannot use the relay to tell a bad tag from a bad envelope.
 * Drops are counted and logged at TRACE without detail.
 */
public final class SealedWireFormat implements WireFormat
{
    private static final Logger log = LoggerFactory.getLogger(SealedWireFormat.class);

    public static final int DEFAULT_MAX_RECORD_LENGTH = 64 * 1024;

    private static final byte[] NOTHING = new byte[0];

    private final PacketCodec codec;
    private final String passphrase;
    private final int maxRecordLength;

    public SealedWireFormat(PacketCodec codec, String passphrase)
    {
        this(codec, passphrase, DEFAULT_MAX_RECORD_LENGTH);
    }

    public SealedWireFormat(PacketCodec codec, String passphrase, int maxRecordLength)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.passphrase = Objects.requireNonNull(passphrase, "passphrase");
        if (maxRecordLength < 1) {
            throw new IllegalArgumentException("maxRecordLength must be positive");
        }
        this.maxRecordLength = maxRecordLength;
    }

    @Override
    public UnitSource source(InputStream transportIn)
    {
        return new SealedLineSource(new BoundedLineReader(transportIn, maxRecordLength));
    }

    @Override
    public UnitSink sink(OutputStream transportOut)
    {
        Objects.requireNonNull(transportOut, "transportOut");
        return unit -> {
            String bundle = codec.encrypt(unit, passphrase);
            // Bundle and terminator go out in one write.
            transportOut.write((bundle + "\n").getBytes(StandardCharsets.US_ASCII));
            transportOut.flush();
        };
    }

    @Override
    public boolean isSealed()
    {
        return true;
    }

    private final class SealedLineSource implements UnitSource
    {
        private final BoundedLineReader lines;
        private long dropped;

        private SealedLineSource(BoundedLineReader lines)
        {
            this.lines = lines;
        }

        @Override
        public Optional<byte[]> next() throws IOException
        {
            String line = lines.readLine();
            if (line == null) {
                return Optional.empty();
            }
            if (lines.lastLineTruncated()) {
                return drop();
            }
            if (line.isBlank()) {
                return Optional.of(NOTHING);
            }
            try {
                return Optional.of(codec.decrypt(line, passphrase));
            }
            catch (PacketCodecException e) {
                return drop();
            }
        }

        @Override
        public long droppedUnits()
        {
            return dropped;
        }

        private Optional<byte[]> drop()
        {
            dropped++;
            log.trace("Dropped unreadable record ({} so far)", dropped);
            return Optional.of(NOTHING);
        }
    }
}
