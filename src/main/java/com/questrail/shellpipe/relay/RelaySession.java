package com.questrail.shellpipe.relay;

import com.questrail.shellpipe.host.CommandHost;
import com.questrail.shellpipe.transport.SessionChannels;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RelaySession
 * =============================================================================
 * One connected peer: the two transport directions, the command host, and the
 * two pumps moving bytes between them.
 *
 * <pre>
 *   host stdout  → [OUTBOUND pump] → WireFormat sink   → channels.output
 *   channels.input → WireFormat source → [INBOUND pump] → host stdin
 * </pre>
 *
 * <h2>Ownership</h2>
 * A session is created and owned by a single supervisor iteration. It is not
 * shared and not reused; {@link #teardown(Duration, boolean)} releases
 * everything it holds.
 *
 * <h2>Liveness</h2>
 * {@link #isLive()} is a cheap sample intended for a timed poll. It turns false
 * as soon as either pump has stopped, either transport direction has
 * disconnected, or the host has exited.
 */
public final class RelaySession
{
    private final long id;
    private final SessionChannels channels;
    private final CommandHost host;
    private final WireFormat wireFormat;
    private final int chunkSize;

    private final AtomicBoolean active = new AtomicBoolean(false);
    private ExecutorService executor;
    private Future<PumpResult> outbound;
    private Future<PumpResult> inbound;
    private long startedNanos;

    public RelaySession(long id, SessionChannels channels, CommandHost host, WireFormat wireFormat, int chunkSize)
    {
        this.id = id;
        this.channels = Objects.requireNonNull(channels, "channels");
        this.host = Objects.requireNonNull(host, "host");
        this.wireFormat = Objects.requireNonNull(wireFormat, "wireFormat");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    public long id()
    {
        return id;
    }

    /**
     * Start both pumps. May be called once.
     */
    public synchronized void start()
    {
        if (executor != null) {
            throw new IllegalStateException("Session " + id + " already started");
        }
        startedNanos = System.nanoTime();
        active.set(true);
        executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "shellpipe-session-" + id);
            t.setDaemon(true);
            return t;
        });

        outbound = executor.submit(new RelayPump(
                PumpDirection.OUTBOUND,
                new RawUnitSource(host.stdout(), chunkSize),
                wireFormat.sink(channels.output().output()),
                active));
        inbound = executor.submit(new RelayPump(
                PumpDirection.INBOUND,
                wireFormat.source(channels.input().input()),
                new RawUnitSink(host.stdin()),
                active));
    }

    /**
     * @return {@code true} while both pumps run, both directions are connected
     *         and the host is alive
     */
    public boolean isLive()
    {
        return active.get() && channels.isConnected() && host.isAlive();
    }

    /**
     * Classify why the session is no longer live. Meaningful once
     * {@link #isLive()} has returned {@code false}.
     */
    public TeardownReason diagnose()
    {
        if (!host.isAlive()) {
            return TeardownReason.HOST_EXITED;
        }
        if (!channels.isConnected()) {
            return TeardownReason.TRANSPORT_DISCONNECTED;
        }
        return TeardownReason.PUMP_TERMINATED;
    }

    /**
     * Tear the session down: terminate the host if still running, close both
     * transport directions, join the pumps, and wait for the host's exit code.
     *
     * @param joinTimeout how long to wait for each pump and for the host to exit
     * @param stopped {@code true} if teardown was requested by the supervisor
     *                rather than caused by the session itself
     */
    public synchronized SessionSummary teardown(Duration joinTimeout, boolean stopped)
    {
        Objects.requireNonNull(joinTimeout, "joinTimeout");
        TeardownReason reason = stopped ? TeardownReason.STOPPED : diagnose();

        active.set(false);
        host.destroy();
        channels.close();

        PumpResult out = outbound == null ? PumpResult.stopped(PumpDirection.OUTBOUND)
                : RelayPump.join(outbound, PumpDirection.OUTBOUND, joinTimeout);
        PumpResult in = inbound == null ? PumpResult.stopped(PumpDirection.INBOUND)
                : RelayPump.join(inbound, PumpDirection.INBOUND, joinTimeout);
        if (executor != null) {
            executor.shutdownNow();
        }

        OptionalInt exitCode;
        try {
            exitCode = host.awaitExit(joinTimeout);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = host.exitCode();
        }

        Duration elapsed = startedNanos == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - startedNanos);
        return new SessionSummary(id, reason, out, in, exitCode, elapsed);
    }
}
