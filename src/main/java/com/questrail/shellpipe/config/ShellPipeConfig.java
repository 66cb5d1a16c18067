package com.questrail.shellpipe.config;

import com.questrail.shellpipe.crypto.KeyDerivationPolicy;
import com.questrail.shellpipe.crypto.UniformPaddingStrategy;
import com.questrail.shellpipe.host.HostCredentials;
import com.questrail.shellpipe.host.ProcessCommandHostLauncher;
import com.questrail.shellpipe.relay.PlainWireFormat;
import com.questrail.shellpipe.relay.SealedWireFormat;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for one shellpipe process.
 *
 * <p>An absent {@code passphrase} selects the plain (unencrypted) wire format.
 * {@code credentials} only apply to the server role.</p>
 */
public record ShellPipeConfig(
        Role role,
        Optional<String> passphrase,
        String remoteHost,
        String bindHost,
        int outputPort,
        int inputPort,
        Optional<HostCredentials> credentials,
        List<String> hostCommand,
        RelayTimingPolicy timing,
        int paddingMinLength,
        int paddingMaxLength,
        KeyDerivationPolicy keyDerivation,
        int chunkSize,
        int maxRecordLength
) {
    public static final String DEFAULT_REMOTE_HOST = "localhost";
    public static final String DEFAULT_BIND_HOST = "0.0.0.0";
    public static final int DEFAULT_OUTPUT_PORT = 47001;
    public static final int DEFAULT_INPUT_PORT = 47002;

    public ShellPipeConfig {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(passphrase, "passphrase");
        Objects.requireNonNull(remoteHost, "remoteHost");
        Objects.requireNonNull(bindHost, "bindHost");
        Objects.requireNonNull(credentials, "credentials");
        Objects.requireNonNull(timing, "timing");
        Objects.requireNonNull(keyDerivation, "keyDerivation");
        hostCommand = List.copyOf(Objects.requireNonNull(hostCommand, "hostCommand"));

        if (hostCommand.isEmpty()) {
            throw new IllegalArgumentException("hostCommand must not be empty");
        }
        checkPort(outputPort, "outputPort");
        checkPort(inputPort, "inputPort");
        if (outputPort != 0 && outputPort == inputPort) {
            throw new IllegalArgumentException("outputPort and inputPort must differ");
        }
        if (paddingMinLength < 0 || paddingMaxLength < paddingMinLength
                || paddingMaxLength > UniformPaddingStrategy.MAX_LENGTH_LIMIT) {
            throw new IllegalArgumentException("padding bounds must satisfy 0 <= min <= max <= "
                    + UniformPaddingStrategy.MAX_LENGTH_LIMIT);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (maxRecordLength < 1) {
            throw new IllegalArgumentException("maxRecordLength must be positive");
        }
    }

    /**
     * @return {@code true} if the channel is encrypted
     */
    public boolean sealed() {
        return passphrase.isPresent();
    }

    private static void checkPort(int port, String name) {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Role role = Role.SERVER;
        private String passphrase;
        private String remoteHost = DEFAULT_REMOTE_HOST;
        private String bindHost = DEFAULT_BIND_HOST;
        private int outputPort = DEFAULT_OUTPUT_PORT;
        private int inputPort = DEFAULT_INPUT_PORT;
        private HostCredentials credentials;
        private List<String> hostCommand = ProcessCommandHostLauncher.defaultCommand();
        private RelayTimingPolicy timing = RelayTimingPolicy.defaults();
        private int paddingMinLength = UniformPaddingStrategy.DEFAULT_MIN_LENGTH;
        private int paddingMaxLength = UniformPaddingStrategy.DEFAULT_MAX_LENGTH;
        private KeyDerivationPolicy keyDerivation = KeyDerivationPolicy.defaults();
        private int chunkSize = PlainWireFormat.DEFAULT_CHUNK_SIZE;
        private int maxRecordLength = SealedWireFormat.DEFAULT_MAX_RECORD_LENGTH;

        public Builder withRole(Role role) {
            this.role = role;
            return this;
        }

        /**
         * @param passphrase shared passphrase, or {@code null} for a plain channel
         */
        public Builder withPassphrase(String passphrase) {
            this.passphrase = passphrase;
            return this;
        }

        public Builder withRemoteHost(String remoteHost) {
            this.remoteHost = remoteHost;
            return this;
        }

        public Builder withBindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder withOutputPort(int port) {
            this.outputPort = port;
            return this;
        }

        public Builder withInputPort(int port) {
            this.inputPort = port;
            return this;
        }

        public Builder withCredentials(HostCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder withHostCommand(List<String> command) {
            this.hostCommand = command;
            return this;
        }

        public Builder withTiming(RelayTimingPolicy timing) {
            this.timing = timing;
            return this;
        }

        public Builder withPadding(int minLength, int maxLength) {
            this.paddingMinLength = minLength;
            this.paddingMaxLength = maxLength;
            return this;
        }

        public Builder withKeyDerivation(KeyDerivationPolicy policy) {
            this.keyDerivation = policy;
            return this;
        }

        public Builder withChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder withMaxRecordLength(int maxRecordLength) {
            this.maxRecordLength = maxRecordLength;
            return this;
        }

        public ShellPipeConfig build() {
            return new ShellPipeConfig(
                    role,
                    Optional.ofNullable(passphrase),
                    remoteHost,
                    bindHost,
                    outputPort,
                    inputPort,
                    Optional.ofNullable(credentials),
                    hostCommand,
                    timing,
                    paddingMinLength,
                    paddingMaxLength,
                    keyDerivation,
                    chunkSize,
                    maxRecordLength
            );
        }
    }
}
