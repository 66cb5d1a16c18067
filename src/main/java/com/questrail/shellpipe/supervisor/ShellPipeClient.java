package com.questrail.shellpipe.supervisor;

import com.questrail.shellpipe.config.RelayTimingPolicy;
import com.questrail.shellpipe.config.Role;
import com.questrail.shellpipe.observability.SessionClosedEvent;
import com.questrail.shellpipe.observability.ShellPipeErrorEvent;
import com.questrail.shellpipe.observability.ShellPipeObservabilitySink;
import com.questrail.shellpipe.observability.SupervisorStateTransitionEvent;
import com.questrail.shellpipe.relay.PumpDirection;
import com.questrail.shellpipe.relay.PumpOutcome;
import com.questrail.shellpipe.relay.PumpResult;
import com.questrail.shellpipe.relay.RawUnitSink;
import com.questrail.shellpipe.relay.RelayPump;
import com.questrail.shellpipe.relay.SessionSummary;
import com.questrail.shellpipe.relay.TeardownReason;
import com.questrail.shellpipe.relay.WireFormat;
import com.questrail.shellpipe.transport.SessionChannels;
import com.questrail.shellpipe.transport.TransportClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ShellPipeClient
 * =============================================================================
 * Single-session client supervisor:
 *
 * <pre>
 *   CONNECTING → CONNECTED → TEARDOWN → TERMINAL
 * </pre>
 *
 * <p>While connected, an inbound pump renders whatever the server sends to the
 * local display, and the calling thread runs the outbound pump over local
 * console lines. The session ends when the console reaches end of input, when
 * {@code exit} has been sent and the grace delay has passed, or when the
 * transport goes away (noticed by the console loop on the next line).</p>
 */
public final class ShellPipeClient
{
    private static final long SESSION_ID = 1;

    private final TransportClient transport;
    private final WireFormat wireFormat;
    private final RelayTimingPolicy timing;
    private final InputStream console;
    private final OutputStream display;
    private final Charset charset;
    private final ShellPipeObservabilitySink sink;

    private volatile SupervisorState state = SupervisorState.IDLE;

    public ShellPipeClient(TransportClient transport,
                           WireFormat wireFormat,
                           RelayTimingPolicy timing,
                           InputStream console,
                           OutputStream display,
                           ShellPipeObservabilitySink sink)
    {
        this(transport, wireFormat, timing, console, display, Charset.defaultCharset(), sink);
    }

    public ShellPipeClient(TransportClient transport,
                           WireFormat wireFormat,
                           RelayTimingPolicy timing,
                           InputStream console,
                           OutputStream display,
                           Charset charset,
                           ShellPipeObservabilitySink sink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.wireFormat = Objects.requireNonNull(wireFormat, "wireFormat");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.console = Objects.requireNonNull(console, "console");
        this.display = Objects.requireNonNull(display, "display");
        this.charset = Objects.requireNonNull(charset, "charset");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public SupervisorState state()
    {
        return state;
    }

    /**
     * Connect, relay until the session ends, and tear down.
     *
     * @return summary of the session
     * @throws IOException if the server cannot be reached
     */
    public SessionSummary run() throws IOException
    {
        transition(SupervisorState.CONNECTING);
        final SessionChannels channels;
        try {
            channels = transport.connect();
        }
        catch (IOException e) {
            sink.onError(new ShellPipeErrorEvent(Instant.now(), "Unable to connect to remote system", e));
            transition(SupervisorState.TERMINAL);
            throw e;
        }

        transition(SupervisorState.CONNECTED);
        long started = System.nanoTime();
        AtomicBoolean active = new AtomicBoolean(true);
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "shellpipe-client-inbound");
            t.setDaemon(true);
            return t;
        });

        PumpResult outbound;
        PumpResult inbound;
        ConsoleUnitSource commands = new ConsoleUnitSource(console, charset, timing.exitGraceDelay());
        try {
            Future<PumpResult> pending = executor.submit(new RelayPump(
                    PumpDirection.INBOUND,
                    wireFormat.source(channels.output().input()),
                    new RawUnitSink(display),
                    active));

            outbound = new RelayPump(
                    PumpDirection.OUTBOUND,
                    commands,
                    wireFormat.sink(channels.input().output()),
                    active).call();

            transition(SupervisorState.TEARDOWN);
            active.set(false);
            channels.close();
            inbound = RelayPump.join(pending, PumpDirection.INBOUND, timing.pumpJoinTimeout());
        }
        finally {
            channels.close();
            executor.shutdownNow();
            transport.close();
        }

        TeardownReason reason = commands.exitRequested() || outbound.outcome() == PumpOutcome.END_OF_STREAM
                ? TeardownReason.LOCAL_EXIT
                : TeardownReason.TRANSPORT_DISCONNECTED;
        SessionSummary summary = new SessionSummary(
                SESSION_ID, reason, outbound, inbound, OptionalInt.empty(),
                Duration.ofNanos(System.nanoTime() - started));
        sink.onSessionClosed(new SessionClosedEvent(Instant.now(), Role.CLIENT, summary));
        transition(SupervisorState.TERMINAL);
        return summary;
    }

    private void transition(SupervisorState next)
    {
        SupervisorState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        sink.onStateTransition(new SupervisorStateTransitionEvent(
                Instant.now(), Role.CLIENT, previous, next, wireFormat.isSealed()));
    }
}
