package com.questrail.shellpipe.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * Listening side of the transport.
 *
 * <p>Serves one peer at a time: {@link #awaitPeer()} blocks until a peer has
 * connected both directions and then stops accepting further peers until it
 * is called again.</p>
 */
public interface TransportServer extends Closeable
{
    /**
     * Block until a peer has connected both the output and the input channel.
     *
     * @return the connected channels, owned by the caller from here on
     * @throws IOException if listening or accepting fails
     * @throws InterruptedException if the waiting thread is interrupted
     */
    SessionChannels awaitPeer() throws IOException, InterruptedException;

    /**
     * Stop listening and release transport resources.
     */
    @Override
    void close();
}
