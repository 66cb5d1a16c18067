package com.questrail.shellpipe.relay;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

final class RelayPumpTest {

    /** Yields queued units, then end-of-stream. */
    private static UnitSource units(byte[]... units) {
        Deque<byte[]> queue = new ArrayDeque<>(List.of(units));
        return () -> Optional.ofNullable(queue.poll());
    }

    private static final class CollectingSink implements UnitSink {
        final List<byte[]> written = new ArrayList<>();

        @Override
        public void write(byte[] unit) {
            written.add(unit);
        }
    }

    @Test
    void relaysUntilEndOfStream() {
        CollectingSink sink = new CollectingSink();
        AtomicBoolean active = new AtomicBoolean(true);

        PumpResult result = new RelayPump(PumpDirection.OUTBOUND,
                units(new byte[] { 1 }, new byte[] { 2, 3 }), sink, active).call();

        assertEquals(PumpOutcome.END_OF_STREAM, result.outcome());
        assertEquals(2, result.unitsRelayed());
        assertEquals(2, sink.written.size());
        assertFalse(result.isFailure());
    }

    @Test
    void emptyUnitsAreSkipped() {
        CollectingSink sink = new CollectingSink();

        PumpResult result = new RelayPump(PumpDirection.INBOUND,
                units(new byte[0], new byte[] { 7 }, new byte[0]), sink, new AtomicBoolean(true)).call();

        assertEquals(1, result.unitsRelayed());
        assertArrayEquals(new byte[] { 7 }, sink.written.get(0));
    }

    @Test
    void stoppingClearsTheSessionFlag() {
        AtomicBoolean active = new AtomicBoolean(true);

        new RelayPump(PumpDirection.OUTBOUND, units(), new CollectingSink(), active).call();

        assertFalse(active.get());
    }

    @Test
    void clearedFlagStopsBeforeReading() {
        AtomicBoolean active = new AtomicBoolean(false);
        UnitSource neverRead = () -> {
            throw new AssertionError("source read after session ended");
        };

        PumpResult result = new RelayPump(PumpDirection.INBOUND, neverRead, new CollectingSink(), active).call();

        assertEquals(PumpOutcome.STOPPED, result.outcome());
        assertEquals(0, result.unitsRelayed());
    }

    @Test
    void unitReadAfterFlagClearedIsNotWritten() {
        AtomicBoolean active = new AtomicBoolean(true);
        UnitSource source = () -> {
            active.set(false);
            return Optional.of(new byte[] { 1 });
        };
        CollectingSink sink = new CollectingSink();

        PumpResult result = new RelayPump(PumpDirection.OUTBOUND, source, sink, active).call();

        assertEquals(PumpOutcome.STOPPED, result.outcome());
        assertTrue(sink.written.isEmpty());
    }

    @Test
    void failuresMapToTheFailingSide() {
        UnitSource failingSource = () -> {
            throw new IOException("read failed");
        };
        UnitSink failingSink = unit -> {
            throw new IOException("write failed");
        };

        assertEquals(PumpOutcome.HOST_FAILURE, new RelayPump(PumpDirection.OUTBOUND,
                failingSource, new CollectingSink(), new AtomicBoolean(true)).call().outcome());
        assertEquals(PumpOutcome.TRANSPORT_FAILURE, new RelayPump(PumpDirection.OUTBOUND,
                units(new byte[] { 1 }), failingSink, new AtomicBoolean(true)).call().outcome());
        assertEquals(PumpOutcome.TRANSPORT_FAILURE, new RelayPump(PumpDirection.INBOUND,
                failingSource, new CollectingSink(), new AtomicBoolean(true)).call().outcome());

        PumpResult hostWrite = new RelayPump(PumpDirection.INBOUND,
                units(new byte[] { 1 }), failingSink, new AtomicBoolean(true)).call();
        assertEquals(PumpOutcome.HOST_FAILURE, hostWrite.outcome());
        assertTrue(hostWrite.isFailure());
        assertEquals("write failed", hostWrite.failureCause().orElseThrow().getMessage());
    }

    @Test
    void runtimeExceptionsAreContained() {
        UnitSink exploding = unit -> {
            throw new IllegalStateException("boom");
        };

        PumpResult result = new RelayPump(PumpDirection.OUTBOUND,
                units(new byte[] { 1 }), exploding, new AtomicBoolean(true)).call();

        assertEquals(PumpOutcome.TRANSPORT_FAILURE, result.outcome());
        assertInstanceOf(IllegalStateException.class, result.failure());
    }

    @Test
    void droppedUnitsAreReported() {
        UnitSource source = new UnitSource() {
            private int calls;

            @Override
            public Optional<byte[]> next() {
                return ++calls <= 3 ? Optional.of(new byte[0]) : Optional.empty();
            }

            @Override
            public long droppedUnits() {
                return 3;
            }
        };

        PumpResult result = new RelayPump(PumpDirection.INBOUND, source, new CollectingSink(), new AtomicBoolean(true)).call();

        assertEquals(3, result.unitsDropped());
        assertEquals(0, result.unitsRelayed());
    }

    @Test
    void joinCancelsAPumpThatDoesNotStop() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        UnitSource blocking = () -> {
            started.countDown();
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException();
            }
            return Optional.empty();
        };
        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<PumpResult> pump = exec.submit(new RelayPump(
                    PumpDirection.OUTBOUND, blocking, new CollectingSink(), new AtomicBoolean(true)));
            started.await();

            PumpResult result = RelayPump.join(pump, PumpDirection.OUTBOUND, Duration.ofMillis(100));

            assertEquals(PumpOutcome.STOPPED, result.outcome());
            assertTrue(pump.isCancelled());
        } finally {
            exec.shutdownNow();
        }
    }
}
