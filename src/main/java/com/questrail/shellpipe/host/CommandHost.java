package com.questrail.shellpipe.host;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.OptionalInt;

/**
 * CommandHost
 * -----------------------------------------------------------------------------
 * A running interactive command interpreter owned by one session.
 *
 * <p>The relay only needs its byte streams and its liveness. Error output is
 * expected to be merged into {@link #stdout()} by the launcher.</p>
 */
public interface CommandHost
{
    /**
     * @return the host's standard input
     */
    OutputStream stdin();

    /**
     * @return the host's standard output (with standard error merged in)
     */
    InputStream stdout();

    /**
     * @return {@code true} until the host process has exited
     */
    boolean isAlive();

    /**
     * @return the exit code once the host has exited, empty while it runs
     */
    OptionalInt exitCode();

    /**
     * Wait up to {@code timeout} for the host to exit.
     *
     * @return the exit code, or empty if the host is still running when the
     *         timeout elapses
     */
    OptionalInt awaitExit(Duration timeout) throws InterruptedException;

    /**
     * Forcibly terminate the host. Its output stream then reaches end-of-stream,
     * which unblocks the outbound pump. Idempotent.
     */
    void destroy();
}
