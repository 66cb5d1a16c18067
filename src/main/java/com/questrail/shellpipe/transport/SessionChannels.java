package com.questrail.shellpipe.transport;

import java.io.Closeable;
import java.util.Objects;

/**
 * The two transport directions of one session.
 *
 * <ul>
 *   <li>{@code output} carries command-host output from server to client</li>
 *   <li>{@code input} carries commands from client to server</li>
 * </ul>
 *
 * <p>The server writes {@code output} and reads {@code input}; the client does
 * the opposite.</p>
 */
public record SessionChannels(StreamChannel output, StreamChannel input) implements Closeable {

    public SessionChannels {
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(input, "input");
    }

    /**
     * @return {@code true} only while both directions report a connected peer
     */
    public boolean isConnected() {
        return output.isConnected() && input.isConnected();
    }

    @Override
    public void close() {
        output.close();
        input.close();
    }
}
