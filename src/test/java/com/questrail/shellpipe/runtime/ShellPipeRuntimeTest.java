package com.questrail.shellpipe.runtime;

import com.questrail.shellpipe.config.Role;
import com.questrail.shellpipe.config.ShellPipeConfig;
import com.questrail.shellpipe.host.HostSpawnException;
import com.questrail.shellpipe.observability.RecordingObservabilitySink;
import com.questrail.shellpipe.relay.PlainWireFormat;
import com.questrail.shellpipe.relay.SealedWireFormat;
import com.questrail.shellpipe.relay.WireFormat;
import com.questrail.shellpipe.transport.FakeTransportClient;
import com.questrail.shellpipe.transport.FakeTransportServer;
import com.questrail.shellpipe.transport.LoopbackChannel;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class ShellPipeRuntimeTest {

    @Test
    void passphraseSelectsSealedWireFormat() {
        WireFormat sealed = ShellPipeRuntime.wireFormatFor(ShellPipeConfig.builder().withPassphrase("secret1").build());
        WireFormat plain = ShellPipeRuntime.wireFormatFor(ShellPipeConfig.builder().build());

        assertInstanceOf(SealedWireFormat.class, sealed);
        assertInstanceOf(PlainWireFormat.class, plain);
    }

    @Test
    void serverSpawnFailureGivesFailureExitCode() throws Exception {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        ShellPipeRuntime runtime = ShellPipeRuntime.builder()
            .withConfig(ShellPipeConfig.builder().build())
            .withTransportServer(new FakeTransportServer())
            .withLauncher(() -> {
                throw new HostSpawnException("no shell");
            })
            .withObservabilitySink(sink)
            .build();

        assertEquals(ShellPipeRuntime.EXIT_FAILURE, runtime.run());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void clientRunsOneSessionAndExitsCleanly() throws Exception {
        LoopbackChannel.SessionPair channels = LoopbackChannel.sessionPair();
        ShellPipeRuntime runtime = ShellPipeRuntime.builder()
            .withConfig(ShellPipeConfig.builder().withRole(Role.CLIENT).withPassphrase("secret1").build())
            .withTransportClient(FakeTransportClient.connectingTo(channels.remote()))
            .withConsole(new ByteArrayInputStream("hostname\n".getBytes(StandardCharsets.UTF_8)))
            .withDisplay(new ByteArrayOutputStream())
            .build();

        assertEquals(ShellPipeRuntime.EXIT_OK, runtime.run());
        assertTrue(channels.local().input().input().readAllBytes().length > "hostname\n".length());
    }

    @Test
    void clientConnectFailureGivesFailureExitCode() throws Exception {
        ShellPipeRuntime runtime = ShellPipeRuntime.builder()
            .withConfig(ShellPipeConfig.builder().withRole(Role.CLIENT).build())
            .withTransportClient(FakeTransportClient.failingWith(new IOException("refused")))
            .withConsole(new ByteArrayInputStream(new byte[0]))
            .build();

        assertEquals(ShellPipeRuntime.EXIT_FAILURE, runtime.run());
    }

    @Test
    void configIsRequired() {
        assertThrows(NullPointerException.class, () -> ShellPipeRuntime.builder().build());
    }
}
