package com.questrail.shellpipe.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * Connecting side of the transport.
 */
public interface TransportClient extends Closeable
{
    /**
     * Connect both directions to the configured server endpoint, output channel
     * first.
     *
     * @return the connected channels, owned by the caller from here on
     * @throws IOException if either direction cannot be connected
     */
    SessionChannels connect() throws IOException;

    /**
     * Release transport resources. Channels already handed out stay usable
     * until closed by their owner or until this call tears down the I/O threads.
     */
    @Override
    void close();
}
