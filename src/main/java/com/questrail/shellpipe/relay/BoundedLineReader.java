package com.questrail.shellpipe.relay;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Line reader with an upper bound on line length.
 *
 * <p>Lines end at {@code '\n'}; a preceding {@code '\r'} is stripped. A line
 * longer than {@code maxLength} bytes is consumed up to its terminator but
 * not kept; {@link #lastLineTruncated()} reports this for the line just
 * returned. A final line without terminator is returned before
 * end-of-stream.</p>
 */
final class BoundedLineReader
{
    private final InputStream in;
    private final int maxLength;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream();
    private boolean truncated;

    BoundedLineReader(InputStream in, int maxLength)
    {
        this.in = new BufferedInputStream(Objects.requireNonNull(in, "in"));
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        this.maxLength = maxLength;
    }

    /**
     * @return the next line without its terminator, or {@code null} at end-of-stream
     */
    String readLine() throws IOException
    {
        line.reset();
        truncated = false;
        boolean sawAny = false;

        int b;
        while ((b = in.read()) != -1) {
            sawAny = true;
            if (b == '\n') {
                return current();
            }
            if (line.size() < maxLength) {
                line.write(b);
            }
            else {
                truncated = true;
            }
        }
        return sawAny ? current() : null;
    }

    boolean lastLineTruncated()
    {
        return truncated;
    }

    private String current()
    {
        if (truncated) {
            return "";
        }
        String s = line.toString(StandardCharsets.UTF_8);
        return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
    }
}
