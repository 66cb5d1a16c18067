package com.questrail.shellpipe.transport.netty;

import com.questrail.shellpipe.transport.SessionChannels;
import com.questrail.shellpipe.transport.StreamChannel;
import com.questrail.shellpipe.transport.TransportClient;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * NettyTransportClient
 * =============================================================================
 * Netty-backed {@link TransportClient}: opens one TCP connection per direction
 * to the server's output and input ports.
 */
public final class NettyTransportClient implements TransportClient
{
    private final InetSocketAddress outputEndpoint;
    private final InetSocketAddress inputEndpoint;
    private final EventLoopGroup group;

    public NettyTransportClient(String host, int outputPort, int inputPort)
    {
        this(InetSocketAddress.createUnresolved(host, outputPort), InetSocketAddress.createUnresolved(host, inputPort));
    }

    public NettyTransportClient(InetSocketAddress outputEndpoint, InetSocketAddress inputEndpoint)
    {
        this.outputEndpoint = Objects.requireNonNull(outputEndpoint, "outputEndpoint");
        this.inputEndpoint = Objects.requireNonNull(inputEndpoint, "inputEndpoint");
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public SessionChannels connect() throws IOException
    {
        StreamChannel output = connect(outputEndpoint);
        try {
            StreamChannel input = connect(inputEndpoint);
            return new SessionChannels(output, input);
        }
        catch (IOException e) {
            output.close();
            throw e;
        }
    }

    private StreamChannel connect(InetSocketAddress endpoint) throws IOException
    {
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new NettyStreamChannel.InboundHandler(ch));
                    }
                });

        // Resolve here so a createUnresolved endpoint is looked up on every connect.
        InetSocketAddress target = endpoint.isUnresolved()
                ? new InetSocketAddress(endpoint.getHostString(), endpoint.getPort())
                : endpoint;

        ChannelFuture f = bootstrap.connect(target).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new IOException("Unable to connect to " + target, f.cause());
        }
        // The initializer ran on registration, before the connect completed.
        NettyStreamChannel.InboundHandler inbound = f.channel().pipeline().get(NettyStreamChannel.InboundHandler.class);
        return new NettyStreamChannel(f.channel(), inbound.input());
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }
}
