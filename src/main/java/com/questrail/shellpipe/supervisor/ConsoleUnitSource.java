package com.questrail.shellpipe.supervisor;

import com.questrail.shellpipe.relay.UnitSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns local console lines into units for the client's outbound pump.
 *
 * <p>Each line is trimmed and re-terminated with {@code '\n'}. After the line
 * {@code exit} (any case) has been handed out, the next call waits
 * {@code exitGrace} and then reports end-of-stream.</p>
 */
final class ConsoleUnitSource implements UnitSource
{
    static final String EXIT_COMMAND = "exit";

    private final BufferedReader console;
    private final Charset charset;
    private final Duration exitGrace;

    private boolean exitRequested;

    ConsoleUnitSource(InputStream console, Charset charset, Duration exitGrace)
    {
        this.charset = Objects.requireNonNull(charset, "charset");
        this.console = new BufferedReader(new InputStreamReader(Objects.requireNonNull(console, "console"), charset));
        this.exitGrace = Objects.requireNonNull(exitGrace, "exitGrace");
    }

    @Override
    public Optional<byte[]> next() throws IOException
    {
        if (exitRequested) {
            pause();
            return Optional.empty();
        }

        String line = console.readLine();
        if (line == null) {
            return Optional.empty();
        }
        String command = line.trim();
        if (command.equalsIgnoreCase(EXIT_COMMAND)) {
            exitRequested = true;
        }
        return Optional.of((command + "\n").getBytes(charset));
    }

    /**
     * @return {@code true} once {@code exit} has been read
     */
    boolean exitRequested()
    {
        return exitRequested;
    }

    private void pause() throws InterruptedIOException
    {
        try {
            Thread.sleep(exitGrace.toMillis());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during exit grace delay");
        }
    }
}
