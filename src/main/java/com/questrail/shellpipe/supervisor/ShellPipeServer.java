package com.questrail.shellpipe.supervisor;

import com.questrail.shellpipe.config.RelayTimingPolicy;
import com.questrail.shellpipe.config.Role;
import com.questrail.shellpipe.host.CommandHost;
import com.questrail.shellpipe.host.CommandHostLauncher;
import com.questrail.shellpipe.host.HostSpawnException;
import com.questrail.shellpipe.observability.SessionClosedEvent;
import com.questrail.shellpipe.observability.ShellPipeErrorEvent;
import com.questrail.shellpipe.observability.ShellPipeObservabilitySink;
import com.questrail.shellpipe.observability.SupervisorStateTransitionEvent;
import com.questrail.shellpipe.relay.RelaySession;
import com.questrail.shellpipe.relay.SessionSummary;
import com.questrail.shellpipe.relay.WireFormat;
import com.questrail.shellpipe.transport.SessionChannels;
import com.questrail.shellpipe.transport.TransportServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * ShellPipeServer
 * =============================================================================
 * Long-running server supervisor. Serves one peer at a time, sequentially:
 *
 * <pre>
 *   IDLE → SPAWNING_HOST → WAITING_FOR_PEER → CONNECTED → TEARDOWN → IDLE ...
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>The command host cannot be spawned: reported, loop ends,
 *       {@link #run()} throws {@link HostSpawnException}.</li>
 *   <li>Accepting a peer fails: the host is destroyed, the error is reported
 *       and the loop starts over after {@code acceptRetryDelay}.</li>
 *   <li>Anything that goes wrong inside a session: contained to that session,
 *       which is torn down; the loop continues.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * {@link #run()} occupies the calling thread. {@link #stop()} and
 * {@link #state()} may be called from any thread.
 */
public final class ShellPipeServer
{
    private static final Logger log = LoggerFactory.getLogger(ShellPipeServer.class);

    private final TransportServer transport;
    private final CommandHostLauncher launcher;
    private final WireFormat wireFormat;
    private final RelayTimingPolicy timing;
    private final int chunkSize;
    private final ShellPipeObservabilitySink sink;

    private volatile boolean running;
    private volatile SupervisorState state = SupervisorState.IDLE;
    private long sessions;

    public ShellPipeServer(TransportServer transport,
                           CommandHostLauncher launcher,
                           WireFormat wireFormat,
                           RelayTimingPolicy timing,
                           int chunkSize,
                           ShellPipeObservabilitySink sink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.wireFormat = Objects.requireNonNull(wireFormat, "wireFormat");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    public SupervisorState state()
    {
        return state;
    }

    /**
     * @return number of sessions that reached {@link SupervisorState#CONNECTED}
     */
    public synchronized long sessionCount()
    {
        return sessions;
    }

    /**
     * Run the supervisor loop until {@link #stop()} is called.
     *
     * @throws HostSpawnException if the command host cannot be launched
     * @throws InterruptedException if the calling thread is interrupted; an
     *         active session is torn down first
     */
    public void run() throws HostSpawnException, InterruptedException
    {
        running = true;
        try {
            while (running) {
                serveOnePeer();
            }
        }
        finally {
            transition(SupervisorState.TERMINAL);
        }
    }

    /**
     * End the loop. A session in progress is torn down within one liveness
     * poll interval; a wait for a peer is abandoned immediately.
     */
    public void stop()
    {
        running = false;
        transport.close();
    }

    private void serveOnePeer() throws HostSpawnException, InterruptedException
    {
        transition(SupervisorState.SPAWNING_HOST);
        final CommandHost host;
        try {
            host = launcher.launch();
        }
        catch (HostSpawnException e) {
            running = false;
            sink.onError(new ShellPipeErrorEvent(Instant.now(), "Unable to start command host", e));
            throw e;
        }

        transition(SupervisorState.WAITING_FOR_PEER);
        final SessionChannels channels;
        try {
            channels = transport.awaitPeer();
        }
        catch (IOException e) {
            host.destroy();
            if (running) {
                sink.onError(new ShellPipeErrorEvent(Instant.now(), "Failed to accept peer", e));
                transition(SupervisorState.IDLE);
                Thread.sleep(timing.acceptRetryDelay().toMillis());
            }
            return;
        }
        catch (InterruptedException e) {
            host.destroy();
            throw e;
        }

        transition(SupervisorState.CONNECTED);
        RelaySession session;
        synchronized (this) {
            session = new RelaySession(++sessions, channels, host, wireFormat, chunkSize);
        }
        session.start();

        InterruptedException interruption = null;
        try {
            while (running && session.isLive()) {
                Thread.sleep(timing.livenessPollInterval().toMillis());
            }
        }
        catch (InterruptedException e) {
            interruption = e;
        }

        transition(SupervisorState.TEARDOWN);
        SessionSummary summary = session.teardown(timing.pumpJoinTimeout(), !running || interruption != null);
        log.debug("Session {} ended: {}", summary.sessionId(), summary.reason());
        sink.onSessionClosed(new SessionClosedEvent(Instant.now(), Role.SERVER, summary));
        transition(SupervisorState.IDLE);

        if (interruption != null) {
            throw interruption;
        }
    }

    private void transition(SupervisorState next)
    {
        SupervisorState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        sink.onStateTransition(new SupervisorStateTransitionEvent(
                Instant.now(), Role.SERVER, previous, next, wireFormat.isSealed()));
    }
}
