package com.questrail.shellpipe.transport;

import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * QueueInputStream
 * -----------------------------------------------------------------------------
 * Blocking {@link InputStream} fed with chunks by a producer thread.
 *
 * <p>This bridges push-style I/O (e.g. a Netty event loop delivering received
 * buffers) to the pull-style blocking reads the relay pumps expect. Chunks are
 * read in the order they were offered. After {@link #finish()} the reader
 * drains what is left and then sees end-of-stream.</p>
 *
 * <h2>Flow control</h2>
 * {@link #offer(byte[])} never blocks, because the producer is usually an event
 * loop. Instead the stream counts the bytes waiting in the queue: once they
 * reach the high watermark it asks its {@link FlowControl} to pause the
 * producer, and once the reader drains them to the low watermark it asks for a
 * resume. A producer that honours the pause keeps the queue bounded.
 *
 * <p>One producer and one consumer thread at a time.</p>
 */
public final class QueueInputStream extends InputStream
{
    /**
     * Hook through which the stream throttles its producer. Called at most once
     * per transition, from whichever thread crossed the watermark.
     */
    public interface FlowControl
    {
        FlowControl NONE = new FlowControl() {
            @Override
            public void pause() {}

            @Override
            public void resume() {}
        };

        void pause();

        void resume();
    }

    private static final byte[] END = new byte[0];

    private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private final AtomicBoolean finished = new AtomicBoolean(false);

    private final long highWatermark;
    private final long lowWatermark;
    private final FlowControl flowControl;
    private final Object flowLock = new Object();
    private long queuedBytes;
    private boolean paused;

    private byte[] current;
    private int position;
    private boolean endOfStream;

    /**
     * A stream without flow control.
     */
    public QueueInputStream()
    {
        this(Long.MAX_VALUE, Long.MAX_VALUE, FlowControl.NONE);
    }

    /**
     * @param highWatermark queued bytes at which the producer is paused
     * @param lowWatermark queued bytes at which a paused producer is resumed
     * @param flowControl the producer's throttle
     */
    public QueueInputStream(long highWatermark, long lowWatermark, FlowControl flowControl)
    {
        if (highWatermark <= 0) {
            throw new IllegalArgumentException("highWatermark must be positive");
        }
        if (lowWatermark < 0 || lowWatermark > highWatermark) {
            throw new IllegalArgumentException("lowWatermark must be in [0, highWatermark]");
        }
        this.highWatermark = highWatermark;
        this.lowWatermark = lowWatermark;
        this.flowControl = Objects.requireNonNull(flowControl, "flowControl");
    }

    /**
     * Enqueue a chunk for the reader. Ignored once the stream is finished.
     * The array is handed over, not copied.
     */
    public void offer(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");
        if (chunk.length == 0 || finished.get()) {
            return;
        }
        synchronized (flowLock) {
            queuedBytes += chunk.length;
            chunks.offer(chunk);
            if (!paused && queuedBytes >= highWatermark) {
                paused = true;
                flowControl.pause();
            }
        }
    }

    /**
     * Mark end-of-stream. Idempotent.
     */
    public void finish()
    {
        if (finished.compareAndSet(false, true)) {
            chunks.offer(END);
        }
    }

    public boolean isFinished()
    {
        return finished.get();
    }

    /**
     * @return bytes offered but not yet taken by the reader
     */
    public long queuedBytes()
    {
        synchronized (flowLock) {
            return queuedBytes;
        }
    }

    @Override
    public int read() throws InterruptedIOException
    {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws InterruptedIOException
    {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (!fill()) {
            return -1;
        }
        int n = Math.min(len, current.length - position);
        System.arraycopy(current, position, b, off, n);
        position += n;
        return n;
    }

    @Override
    public int available()
    {
        return current == null ? 0 : current.length - position;
    }

    @Override
    public void close()
    {
        finish();
    }

    private boolean fill() throws InterruptedIOException
    {
        if (current != null && position < current.length) {
            return true;
        }
        if (endOfStream) {
            return false;
        }
        try {
            byte[] next = chunks.take();
            if (next == END) {
                endOfStream = true;
                current = null;
                return false;
            }
            current = next;
            position = 0;
            taken(next.length);
            return true;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for transport data");
        }
    }

    private void taken(int length)
    {
        synchronized (flowLock) {
            queuedBytes -= length;
            if (paused && queuedBytes <= lowWatermark) {
                paused = false;
                flowControl.resume();
            }
        }
    }
}
