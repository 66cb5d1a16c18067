package com.questrail.shellpipe.runtime;

import com.questrail.shellpipe.codec.PacketCodec;
import com.questrail.shellpipe.codec.impl.AesGcmPacketCodec;
import com.questrail.shellpipe.codec.impl.JsonBundleSerializer;
import com.questrail.shellpipe.config.Role;
import com.questrail.shellpipe.config.ShellPipeConfig;
import com.questrail.shellpipe.crypto.Pbkdf2KeyDerivation;
import com.questrail.shellpipe.crypto.UniformPaddingStrategy;
import com.questrail.shellpipe.host.CommandHostLauncher;
import com.questrail.shellpipe.host.HostSpawnException;
import com.questrail.shellpipe.host.ProcessCommandHostLauncher;
import com.questrail.shellpipe.observability.NullObservabilitySink;
import com.questrail.shellpipe.observability.ShellPipeObservabilitySink;
import com.questrail.shellpipe.relay.PlainWireFormat;
import com.questrail.shellpipe.relay.SealedWireFormat;
import com.questrail.shellpipe.relay.SessionSummary;
import com.questrail.shellpipe.relay.WireFormat;
import com.questrail.shellpipe.supervisor.ShellPipeClient;
import com.questrail.shellpipe.supervisor.ShellPipeServer;
import com.questrail.shellpipe.transport.TransportClient;
import com.questrail.shellpipe.transport.TransportServer;
import com.questrail.shellpipe.transport.netty.NettyTransportClient;
import com.questrail.shellpipe.transport.netty.NettyTransportServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * ShellPipeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one shellpipe process.
 *
 * <p>Wires the codec, wire format, transport, command-host launcher and
 * observability sink for the configured {@link Role}, then runs the matching
 * supervisor on the calling thread.</p>
 */
public final class ShellPipeRuntime {
    private static final Logger log = LoggerFactory.getLogger(ShellPipeRuntime.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final ShellPipeConfig config;
    private final ShellPipeServer server;
    private final ShellPipeClient client;

    private ShellPipeRuntime(ShellPipeConfig config, ShellPipeServer server, ShellPipeClient client) {
        this.config = config;
        this.server = server;
        this.client = client;
    }

    /**
     * Run the supervisor for the configured role. Blocks until the server is
     * stopped or the client session ends.
     *
     * @return process exit status
     * @throws InterruptedException if the calling thread is interrupted
     */
    public int run() throws InterruptedException {
        if (config.role() == Role.SERVER) {
            try {
                server.run();
                return EXIT_OK;
            } catch (HostSpawnException e) {
                // Already reported through the observability sink.
                return EXIT_FAILURE;
            }
        }

        try {
            SessionSummary summary = client.run();
            log.debug("Client session ended: {}", summary.reason());
            return EXIT_OK;
        } catch (IOException e) {
            // Already reported through the observability sink.
            return EXIT_FAILURE;
        }
    }

    /**
     * Ask a running server to stop. No effect in the client role, whose
     * session ends with the console.
     */
    public void stop() {
        if (server != null) {
            server.stop();
        }
    }

    /**
     * Build the wire format for a configuration: sealed when a passphrase is
     * present, plain otherwise.
     */
    static WireFormat wireFormatFor(ShellPipeConfig config) {
        if (config.passphrase().isEmpty()) {
            return new PlainWireFormat(config.chunkSize());
        }
        SecureRandom random = new SecureRandom();
        PacketCodec codec = new AesGcmPacketCodec(
            new Pbkdf2KeyDerivation(config.keyDerivation(), random),
            new UniformPaddingStrategy(config.paddingMinLength(), config.paddingMaxLength(), random),
            random,
            new JsonBundleSerializer());
        return new SealedWireFormat(codec, config.passphrase().get(), config.maxRecordLength());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ShellPipeConfig config;
        private ShellPipeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private CommandHostLauncher launcher;
        private TransportServer transportServer;
        private TransportClient transportClient;
        private InputStream console = System.in;
        private OutputStream display = System.out;

        public Builder withConfig(ShellPipeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(ShellPipeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replace the process launcher derived from the configuration.
         */
        public Builder withLauncher(CommandHostLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder withTransportServer(TransportServer transport) {
            this.transportServer = transport;
            return this;
        }

        public Builder withTransportClient(TransportClient transport) {
            this.transportClient = transport;
            return this;
        }

        public Builder withConsole(InputStream console) {
            this.console = console;
            return this;
        }

        public Builder withDisplay(OutputStream display) {
            this.display = display;
            return this;
        }

        public ShellPipeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            WireFormat wireFormat = wireFormatFor(config);

            if (config.role() == Role.SERVER) {
                TransportServer transport = transportServer != null ? transportServer
                    : new NettyTransportServer(
                        new InetSocketAddress(config.bindHost(), config.outputPort()),
                        new InetSocketAddress(config.bindHost(), config.inputPort()));
                CommandHostLauncher hostLauncher = launcher != null ? launcher
                    : new ProcessCommandHostLauncher(config.hostCommand(), config.credentials());
                ShellPipeServer server = new ShellPipeServer(
                    transport, hostLauncher, wireFormat, config.timing(), config.chunkSize(), observabilitySink);
                return new ShellPipeRuntime(config, server, null);
            }

            TransportClient transport = transportClient != null ? transportClient
                : new NettyTransportClient(config.remoteHost(), config.outputPort(), config.inputPort());
            ShellPipeClient client = new ShellPipeClient(
                transport, wireFormat, config.timing(),
                Objects.requireNonNull(console, "console"),
                Objects.requireNonNull(display, "display"),
                observabilitySink);
            return new ShellPipeRuntime(config, null, client);
        }
    }
}
