package com.questrail.shellpipe.relay;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Unencrypted mode: bytes cross the transport as they are.
 */
public final class PlainWireFormat implements WireFormat
{
    public static final int DEFAULT_CHUNK_SIZE = 1024;

    private final int chunkSize;

    public PlainWireFormat()
    {
        this(DEFAULT_CHUNK_SIZE);
    }

    public PlainWireFormat(int chunkSize)
    {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    @Override
    public UnitSource source(InputStream transportIn)
    {
        return new RawUnitSource(transportIn, chunkSize);
    }

    @Override
    public UnitSink sink(OutputStream transportOut)
    {
        return new RawUnitSink(transportOut);
    }

    @Override
    public boolean isSealed()
    {
        return false;
    }
}
