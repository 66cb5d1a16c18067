package com.questrail.shellpipe.host;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandHost} wrapping a {@link Process}.
 */
public final class ProcessCommandHost implements CommandHost
{
    private final Process process;

    public ProcessCommandHost(Process process)
    {
        this.process = Objects.requireNonNull(process, "process");
    }

    @Override
    public OutputStream stdin()
    {
        return process.getOutputStream();
    }

    @Override
    public InputStream stdout()
    {
        return process.getInputStream();
    }

    @Override
    public boolean isAlive()
    {
        return process.isAlive();
    }

    @Override
    public OptionalInt exitCode()
    {
        return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
    }

    @Override
    public OptionalInt awaitExit(Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");
        return process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)
                ? OptionalInt.of(process.exitValue())
                : OptionalInt.empty();
    }

    @Override
    public void destroy()
    {
        if (process.isAlive()) {
            // Children first: an interactive shell may be blocked on a foreground job.
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }

    public long pid()
    {
        return process.pid();
    }

    @Override
    public String toString()
    {
        return "ProcessCommandHost[pid=" + process.pid() + "]";
    }
}
