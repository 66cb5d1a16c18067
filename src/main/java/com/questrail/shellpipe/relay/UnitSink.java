package com.questrail.shellpipe.relay;

import java.io.IOException;

/**
 * Push side of a pump. Each call writes and flushes one unit.
 */
@FunctionalInterface
public interface UnitSink
{
    void write(byte[] unit) throws IOException;
}
