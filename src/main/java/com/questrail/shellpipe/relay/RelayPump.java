package com.questrail.shellpipe.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RelayPump
 * =============================================================================
 * Moves units from a {@link UnitSource} to a {@link UnitSink} until one of them
 * gives out or the session is over.
 *
 * <h2>Session flag</h2>
 * The pump shares an {@link AtomicBoolean} with its session. It stops when it
 * finds the flag cleared, and it clears the flag itself when it stops, so the
 * supervisor's liveness poll notices a finished pump on its next sample.
 *
 * <h2>Error containment</h2>
 * Nothing thrown by the source or the sink escapes {@link #call()}. Every way
 * out is described by the returned {@link PumpResult}; the supervisor decides
 * what to do with it. There is no retry inside a pump.
 */
public final class RelayPump implements Callable<PumpResult>
{
    private static final Logger log = LoggerFactory.getLogger(RelayPump.class);

    private final PumpDirection direction;
    private final UnitSource source;
    private final UnitSink sink;
    private final AtomicBoolean sessionActive;

    private long relayed;

    public RelayPump(PumpDirection direction, UnitSource source, UnitSink sink, AtomicBoolean sessionActive)
    {
        this.direction = Objects.requireNonNull(direction, "direction");
        this.source = Objects.requireNonNull(source, "source");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.sessionActive = Objects.requireNonNull(sessionActive, "sessionActive");
    }

    @Override
    public PumpResult call()
    {
        try {
            while (sessionActive.get()) {
                final Optional<byte[]> unit;
                try {
                    unit = source.next();
                }
                catch (Exception e) {
                    return finish(direction.sourceFailure(), e);
                }

                if (unit.isEmpty()) {
                    return finish(PumpOutcome.END_OF_STREAM, null);
                }
                byte[] bytes = unit.get();
                if (bytes.length == 0) {
                    continue;
                }
                if (!sessionActive.get()) {
                    break;
                }

                try {
                    sink.write(bytes);
                }
                catch (Exception e) {
                    return finish(direction.sinkFailure(), e);
                }
                relayed++;
            }
            return finish(PumpOutcome.STOPPED, null);
        }
        finally {
            sessionActive.set(false);
        }
    }

    private PumpResult finish(PumpOutcome outcome, Throwable failure)
    {
        PumpResult result = new PumpResult(direction, outcome, relayed, source.droppedUnits(), failure);
        if (failure != null) {
            log.debug("{} pump stopped: {}", direction, outcome, failure);
        }
        else {
            log.debug("{} pump stopped: {}", direction, outcome);
        }
        return result;
    }

    /**
     * Wait for a submitted pump to finish.
     *
     * <p>A pump that does not finish within {@code timeout} is cancelled with
     * interruption and reported as {@link PumpOutcome#STOPPED}.</p>
     */
    public static PumpResult join(Future<PumpResult> pump, PumpDirection direction, Duration timeout)
    {
        try {
            return pump.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (TimeoutException e) {
            log.warn("{} pump did not stop within {}; cancelling", direction, timeout);
            pump.cancel(true);
            return PumpResult.stopped(direction);
        }
        catch (CancellationException e) {
            return PumpResult.stopped(direction);
        }
        catch (ExecutionException e) {
            // call() catches everything it can; this is an Error escaping the pump.
            return new PumpResult(direction, PumpOutcome.STOPPED, 0, 0, e.getCause());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pump.cancel(true);
            return PumpResult.stopped(direction);
        }
    }
}
