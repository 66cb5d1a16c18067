package com.questrail.shellpipe.cli;

import com.questrail.shellpipe.config.Role;
import com.questrail.shellpipe.config.ShellPipeConfig;
import com.questrail.shellpipe.crypto.KeyDerivationPolicy;
import com.questrail.shellpipe.crypto.UniformPaddingStrategy;
import com.questrail.shellpipe.host.HostCredentials;
import com.questrail.shellpipe.observability.Slf4jObservabilitySink;
import com.questrail.shellpipe.relay.SealedWireFormat;
import com.questrail.shellpipe.runtime.ShellPipeRuntime;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line front end. Without {@code --client} the process serves a local
 * command interpreter; with it, the process connects to a server and relays
 * the local console.
 */
@Command(
        name = "shellpipe",
        mixinStandardHelpOptions = true,
        version = "shellpipe 0.1.0",
        description = "Interactive remote command channel, optionally encrypted end to end"
)
public final class ShellPipeCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-p", "--passphrase"},
            description = "Passphrase the encryption key is derived from. Omit for an unencrypted channel.")
    String passphrase;

    @Option(names = {"-c", "--client"}, defaultValue = "false",
            description = "Connect to a server and receive its interactive shell")
    boolean client;

    @Option(names = {"-n", "--name"}, defaultValue = ShellPipeConfig.DEFAULT_REMOTE_HOST,
            description = "Host name of the server (client mode only, default: ${DEFAULT-VALUE})")
    String remoteHost;

    @Option(names = {"--username"},
            description = "Run the shell as this existing user account (server mode only)")
    String username;

    @Option(names = {"--password"},
            description = "Password of the --username account (server mode only)")
    String password;

    @Option(names = {"--domain"},
            description = "Domain of the --username account (server mode only)")
    String domain;

    @Option(names = {"--output-port"}, defaultValue = "" + ShellPipeConfig.DEFAULT_OUTPUT_PORT,
            description = "Port carrying shell output to the client (default: ${DEFAULT-VALUE})")
    int outputPort;

    @Option(names = {"--input-port"}, defaultValue = "" + ShellPipeConfig.DEFAULT_INPUT_PORT,
            description = "Port carrying commands to the server (default: ${DEFAULT-VALUE})")
    int inputPort;

    @Option(names = {"--bind"}, defaultValue = ShellPipeConfig.DEFAULT_BIND_HOST,
            description = "Address the server listens on (default: ${DEFAULT-VALUE})")
    String bindHost;

    @Option(names = {"--shell"}, split = " ",
            description = "Command line of the shell to serve (server mode only)")
    List<String> shell;

    @Option(names = {"--padding-min"}, defaultValue = "" + UniformPaddingStrategy.DEFAULT_MIN_LENGTH,
            description = "Smallest decoy padding block in bytes (default: ${DEFAULT-VALUE})")
    int paddingMin;

    @Option(names = {"--padding-max"}, defaultValue = "" + UniformPaddingStrategy.DEFAULT_MAX_LENGTH,
            description = "Largest decoy padding block in bytes (default: ${DEFAULT-VALUE})")
    int paddingMax;

    @Option(names = {"--kdf-iterations"}, defaultValue = "" + KeyDerivationPolicy.DEFAULT_ITERATIONS,
            description = "PBKDF2 iteration count; both peers must agree (default: ${DEFAULT-VALUE})")
    int kdfIterations;

    @Option(names = {"--max-record-length"}, defaultValue = "" + SealedWireFormat.DEFAULT_MAX_RECORD_LENGTH,
            description = "Longest encrypted line accepted from the peer (default: ${DEFAULT-VALUE})")
    int maxRecordLength;

    @Override
    public Integer call() throws Exception {
        ShellPipeRuntime runtime = ShellPipeRuntime.builder()
                .withConfig(toConfig())
                .withObservabilitySink(new Slf4jObservabilitySink())
                .build();

        Thread hook = new Thread(runtime::stop, "shellpipe-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return runtime.run();
    }

    ShellPipeConfig toConfig() {
        try {
            return buildConfig();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private ShellPipeConfig buildConfig() {
        ShellPipeConfig.Builder builder = ShellPipeConfig.builder()
                .withRole(client ? Role.CLIENT : Role.SERVER)
                .withPassphrase(passphrase)
                .withRemoteHost(remoteHost)
                .withBindHost(bindHost)
                .withOutputPort(outputPort)
                .withInputPort(inputPort)
                .withPadding(paddingMin, paddingMax)
                .withKeyDerivation(KeyDerivationPolicy.defaults().withIterations(kdfIterations))
                .withMaxRecordLength(maxRecordLength);

        if (shell != null && !shell.isEmpty()) {
            builder.withHostCommand(shell);
        }
        credentials().ifPresent(builder::withCredentials);
        return builder.build();
    }

    private Optional<HostCredentials> credentials() {
        if (username == null) {
            if (password != null || domain != null) {
                throw new ParameterException(spec.commandLine(), "--password and --domain require --username");
            }
            return Optional.empty();
        }
        if (client) {
            throw new ParameterException(spec.commandLine(), "--username is only valid in server mode");
        }
        if (password == null) {
            throw new ParameterException(spec.commandLine(), "--username requires --password");
        }
        return Optional.of(new HostCredentials(username, password, Optional.ofNullable(domain)));
    }
}
