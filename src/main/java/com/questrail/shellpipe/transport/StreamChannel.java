package com.questrail.shellpipe.transport;

import java.io.Closeable;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * StreamChannel
 * -----------------------------------------------------------------------------
 * One connected, reliable, ordered byte stream to a peer.
 *
 * <p>Reads and writes are blocking. A read that returns end-of-stream means the
 * peer went away or the channel was closed locally; a write that throws means
 * the same thing for the outbound side.</p>
 *
 * <p>Implementations may be backed by Netty, plain sockets or a test double.
 * Nothing above this interface sees framework types.</p>
 */
public interface StreamChannel extends Closeable
{
    /**
     * @return stream of bytes received from the peer
     */
    InputStream input();

    /**
     * @return stream of bytes sent to the peer; each write is flushed to the wire
     */
    OutputStream output();

    /**
     * Sampled by the supervisor's liveness poll.
     *
     * @return {@code true} while the peer is connected
     */
    boolean isConnected();

    /**
     * Close the channel. Blocked readers observe end-of-stream. Idempotent.
     */
    @Override
    void close();
}
