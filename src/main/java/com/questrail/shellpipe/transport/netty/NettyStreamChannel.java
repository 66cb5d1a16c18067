package com.questrail.shellpipe.transport.netty;

import com.questrail.shellpipe.transport.QueueInputStream;
import com.questrail.shellpipe.transport.StreamChannel;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * NettyStreamChannel
 * =============================================================================
 * Blocking {@link StreamChannel} view of a connected Netty TCP channel.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound {@code ByteBuf}s are
 * copied into {@code byte[]} on the event loop and queued for the reading
 * thread; reference-counted buffers are released by
 * {@link SimpleChannelInboundHandler}.
 *
 * <h2>Backpressure</h2>
 * The inbound queue pauses {@code autoRead} once {@value #INBOUND_HIGH_WATERMARK}
 * bytes are waiting for the reader and restores it at
 * {@value #INBOUND_LOW_WATERMARK}. A reader that falls behind therefore stalls
 * the peer through TCP flow control instead of growing the heap.
 *
 * <h2>Threading</h2>
 * Writes block the calling thread until Netty reports the write outcome. They
 * must therefore never be issued from an event-loop thread; the relay pumps
 * and the client's console loop are plain threads.
 */
final class NettyStreamChannel implements StreamChannel
{
    private static final Logger log = LoggerFactory.getLogger(NettyStreamChannel.class);

    static final int INBOUND_HIGH_WATERMARK = 256 * 1024;
    static final int INBOUND_LOW_WATERMARK = 64 * 1024;

    private final Channel channel;
    private final QueueInputStream input;
    private final OutputStream output;

    NettyStreamChannel(Channel channel, QueueInputStream input)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.input = Objects.requireNonNull(input, "input");
        this.output = new ChannelOutputStream();
    }

    @Override
    public InputStream input()
    {
        return input;
    }

    @Override
    public OutputStream output()
    {
        return output;
    }

    @Override
    public boolean isConnected()
    {
        return channel.isActive();
    }

    @Override
    public void close()
    {
        channel.close().awaitUninterruptibly();
        input.finish();
    }

    @Override
    public String toString()
    {
        return "NettyStreamChannel[" + channel.localAddress() + " <-> " + channel.remoteAddress() + "]";
    }

    /**
     * Writes each call as one flushed buffer and waits for the result.
     */
    private final class ChannelOutputStream extends OutputStream
    {
        @Override
        public void write(int b) throws IOException
        {
            write(new byte[] { (byte) b }, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException
        {
            Objects.checkFromIndexSize(off, len, b.length);
            if (len == 0) {
                return;
            }
            if (!channel.isActive()) {
                throw new IOException("Channel is not connected: " + channel);
            }

            // Copy: the caller may reuse its buffer as soon as we return.
            ByteBuf buf = Unpooled.wrappedBuffer(Arrays.copyOfRange(b, off, off + len));
            ChannelFuture f = channel.writeAndFlush(buf).awaitUninterruptibly();
            if (!f.isSuccess()) {
                throw new IOException("Write to " + channel.remoteAddress() + " failed", f.cause());
            }
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies received bytes into the channel's {@link QueueInputStream} and
     * signals end-of-stream when the connection goes inactive. The queue
     * throttles the channel through {@code autoRead}.
     */
    static final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final QueueInputStream sink;

        InboundHandler(Channel channel)
        {
            this.sink = new QueueInputStream(INBOUND_HIGH_WATERMARK, INBOUND_LOW_WATERMARK,
                    new AutoReadFlowControl(channel));
        }

        QueueInputStream input()
        {
            return sink;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);
            sink.offer(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            sink.finish();
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("Transport error on {}", ctx.channel(), cause);
            sink.finish();
            ctx.close();
        }
    }

    private record AutoReadFlowControl(Channel channel) implements QueueInputStream.FlowControl
    {
        @Override
        public void pause()
        {
            log.trace("Inbound queue full, pausing reads on {}", channel);
            channel.config().setAutoRead(false);
        }

        @Override
        public void resume()
        {
            log.trace("Inbound queue drained, resuming reads on {}", channel);
            channel.config().setAutoRead(true);
        }
    }
}
