package com.questrail.shellpipe.relay;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Writes units verbatim and flushes after each one.
 */
public final class RawUnitSink implements UnitSink
{
    private final OutputStream out;

    public RawUnitSink(OutputStream out)
    {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void write(byte[] unit) throws IOException
    {
        out.write(unit);
        out.flush();
    }
}
