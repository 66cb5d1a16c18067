package com.questrail.shellpipe.relay;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads whatever a single blocking read returns, up to {@code chunkSize} bytes.
 *
 * <p>Interactive output arrives in small bursts, so a unit is usually a line
 * or a prompt rather than a full chunk.</p>
 */
public final class RawUnitSource implements UnitSource
{
    private static final byte[] NOTHING = new byte[0];

    private final InputStream in;
    private final byte[] buffer;

    public RawUnitSource(InputStream in, int chunkSize)
    {
        this.in = Objects.requireNonNull(in, "in");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.buffer = new byte[chunkSize];
    }

    @Override
    public Optional<byte[]> next() throws IOException
    {
        int n = in.read(buffer);
        if (n < 0) {
            return Optional.empty();
        }
        return Optional.of(n == 0 ? NOTHING : Arrays.copyOf(buffer, n));
    }
}
