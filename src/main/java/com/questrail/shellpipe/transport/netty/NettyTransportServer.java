package com.questrail.shellpipe.transport.netty;

import com.questrail.shellpipe.transport.SessionChannels;
import com.questrail.shellpipe.transport.TransportServer;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * NettyTransportServer
 * =============================================================================
 * Netty-backed {@link TransportServer} listening on two TCP ports, one per
 * session direction.
 *
 * <h2>Single-peer rule</h2>
 * Each {@link #awaitPeer()} call accepts exactly one connection per port. The
 * first accepted connection wins; anything else that races in is closed
 * immediately. Once both directions are connected the listening sockets are
 * closed, so no further peer can connect until the supervisor comes back
 * for the next session.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #listen()} binds both ports (idempotent, called by awaitPeer)</li>
 *   <li>{@link #awaitPeer()} blocks for the peer, then unbinds</li>
 *   <li>{@link #close()} unbinds and shuts down the event loop group</li>
 * </ul>
 */
public final class NettyTransportServer implements TransportServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyTransportServer.class);

    /**
     * Addresses actually bound by {@link #listen()}; relevant when ephemeral
     * ports were requested.
     */
    public record BoundAddresses(InetSocketAddress output, InetSocketAddress input) {}

    private final InetSocketAddress outputBind;
    private final InetSocketAddress inputBind;
    private final EventLoopGroup group;

    private Listener outputListener;
    private Listener inputListener;

    public NettyTransportServer(InetSocketAddress outputBind, InetSocketAddress inputBind)
    {
        this.outputBind = Objects.requireNonNull(outputBind, "outputBind");
        this.inputBind = Objects.requireNonNull(inputBind, "inputBind");
        this.group = new NioEventLoopGroup(2);
    }

    /**
     * Bind both listening ports if they are not bound yet.
     *
     * @return the bound addresses
     * @throws IOException if either port cannot be bound
     */
    public synchronized BoundAddresses listen() throws IOException
    {
        if (outputListener == null) {
            outputListener = bind(outputBind);
        }
        if (inputListener == null) {
            try {
                inputListener = bind(inputBind);
            }
            catch (IOException e) {
                unbind();
                throw e;
            }
        }
        return new BoundAddresses(outputListener.address(), inputListener.address());
    }

    @Override
    public SessionChannels awaitPeer() throws IOException, InterruptedException
    {
        listen();
        Listener out;
        Listener in;
        synchronized (this) {
            out = outputListener;
            in = inputListener;
        }

        NettyStreamChannel output = null;
        try {
            output = out.awaitPeer();
            NettyStreamChannel input = in.awaitPeer();
            log.debug("Peer connected on {} and {}", output, input);
            return new SessionChannels(output, input);
        }
        catch (IOException | InterruptedException e) {
            if (output != null) {
                output.close();
            }
            throw e;
        }
        finally {
            unbind();
        }
    }

    @Override
    public void close()
    {
        unbind();
        group.shutdownGracefully();
    }

    private synchronized void unbind()
    {
        if (outputListener != null) {
            outputListener.close();
            outputListener = null;
        }
        if (inputListener != null) {
            inputListener.close();
            inputListener = null;
        }
    }

    private Listener bind(InetSocketAddress address) throws IOException
    {
        CompletableFuture<NettyStreamChannel> accepted = new CompletableFuture<>();

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyStreamChannel.InboundHandler inbound = new NettyStreamChannel.InboundHandler(ch);
                        ch.pipeline().addLast(inbound);
                        if (!accepted.complete(new NettyStreamChannel(ch, inbound.input()))) {
                            log.debug("Rejecting additional peer {} on {}", ch.remoteAddress(), address);
                            ch.close();
                        }
                    }
                });

        ChannelFuture f = bootstrap.bind(address).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new IOException("Unable to listen on " + address, f.cause());
        }
        return new Listener(f.channel(), accepted);
    }

    private record Listener(Channel serverChannel, CompletableFuture<NettyStreamChannel> accepted)
    {
        InetSocketAddress address()
        {
            return (InetSocketAddress) serverChannel.localAddress();
        }

        NettyStreamChannel awaitPeer() throws IOException, InterruptedException
        {
            try {
                return accepted.get();
            }
            catch (ExecutionException e) {
                throw new IOException("Accept failed on " + address(), e.getCause());
            }
        }

        void close()
        {
            InetSocketAddress address = address();
            serverChannel.close().awaitUninterruptibly();
            // Unblock a waiter; a no-op when a peer was already accepted.
            accepted.completeExceptionally(new IOException("Listener on " + address + " closed"));
        }
    }
}
