package com.questrail.shellpipe.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * ProcessCommandHostLauncher
 * =============================================================================
 * Launches the command host as a child process through {@link ProcessBuilder}.
 *
 * <h2>Streams</h2>
 * Standard input and output are piped; standard error is merged into standard
 * output so both reach the remote peer through the outbound pump. Nothing but
 * relayed input is ever written to the host's standard input.
 *
 * <h2>Alternate identity</h2>
 * {@link ProcessBuilder} cannot start a process as another account. When
 * {@link HostCredentials} name an account other than the current one:
 * <ul>
 *   <li>on Unix-like systems the command is wrapped in
 *       {@code sudo -A -k -u <user> --}. If sudo prompts, it runs a private
 *       askpass helper that prints the password from the
 *       {@value #ASKPASS_SECRET_VARIABLE} environment variable; sudo's
 *       {@code env_reset} keeps that variable out of the host. A root JVM is
 *       never prompted and uses {@code sudo -n} without the helper.</li>
 *   <li>on Windows there is no equivalent and the launch fails with
 *       {@link HostSpawnException}</li>
 * </ul>
 */
public final class ProcessCommandHostLauncher implements CommandHostLauncher
{
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandHostLauncher.class);

    static final String ASKPASS_SECRET_VARIABLE = "SHELLPIPE_SUDO_PASSWORD";
    private static final String ASKPASS_SCRIPT =
            "#!/bin/sh\nprintf '%s\\n' \"$" + ASKPASS_SECRET_VARIABLE + "\"\n";

    private final List<String> command;
    private final Optional<HostCredentials> credentials;
    private final boolean windows;
    private final String sudo;
    private final String currentUser;

    public ProcessCommandHostLauncher()
    {
        this(defaultCommand(), Optional.empty());
    }

    public ProcessCommandHostLauncher(List<String> command, Optional<HostCredentials> credentials)
    {
        this(command, credentials, isWindows());
    }

    ProcessCommandHostLauncher(List<String> command, Optional<HostCredentials> credentials, boolean windows)
    {
        this(command, credentials, windows, "sudo", System.getProperty("user.name", ""));
    }

    ProcessCommandHostLauncher(List<String> command,
                               Optional<HostCredentials> credentials,
                               boolean windows,
                               String sudo,
                               String currentUser)
    {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.windows = windows;
        this.sudo = Objects.requireNonNull(sudo, "sudo");
        this.currentUser = Objects.requireNonNull(currentUser, "currentUser");
    }

    /**
     * @return {@code powershell.exe} on Windows, an interactive {@code /bin/sh} elsewhere
     */
    public static List<String> defaultCommand()
    {
        return isWindows() ? List.of("powershell.exe") : List.of("/bin/sh", "-i");
    }

    @Override
    public CommandHost launch() throws HostSpawnException
    {
        List<String> effective = effectiveCommand();

        ProcessBuilder builder = new ProcessBuilder(effective).redirectErrorStream(true);
        Path askpass = null;
        if (switchesIdentity()) {
            // Start somewhere every account can read; the caller's cwd may be private.
            builder.directory(new File("/"));
            if (!runningAsRoot()) {
                askpass = writeAskpassHelper();
                builder.environment().put("SUDO_ASKPASS", askpass.toString());
                builder.environment().put(ASKPASS_SECRET_VARIABLE, credentials.get().password());
            }
        }

        final Process process;
        try {
            process = builder.start();
        }
        catch (IOException | SecurityException e) {
            deleteAskpassHelper(askpass);
            throw new HostSpawnException("Unable to start command host " + effective, e);
        }

        if (askpass != null) {
            Path helper = askpass;
            process.onExit().thenRun(() -> deleteAskpassHelper(helper));
        }

        log.debug("Command host started: pid={} command={}", process.pid(), effective);
        return new ProcessCommandHost(process);
    }

    List<String> effectiveCommand() throws HostSpawnException
    {
        if (credentials.isEmpty()) {
            return command;
        }
        if (windows) {
            throw new HostSpawnException("Launching the command host as "
                    + credentials.get().username() + " is not supported on Windows");
        }
        if (!switchesIdentity()) {
            return command;
        }
        List<String> wrapped = new ArrayList<>(List.of(sudo, runningAsRoot() ? "-n" : "-A", "-k",
                "-u", credentials.get().username(), "--"));
        wrapped.addAll(command);
        return wrapped;
    }

    private boolean switchesIdentity()
    {
        return credentials.isPresent() && !windows && !credentials.get().username().equals(currentUser);
    }

    private boolean runningAsRoot()
    {
        return "root".equals(currentUser);
    }

    private static Path writeAskpassHelper() throws HostSpawnException
    {
        try {
            Path helper = Files.createTempFile("shellpipe-askpass-", ".sh",
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
            Files.writeString(helper, ASKPASS_SCRIPT, StandardCharsets.US_ASCII);
            return helper;
        }
        catch (IOException | UnsupportedOperationException e) {
            throw new HostSpawnException("Unable to prepare sudo askpass helper", e);
        }
    }

    private static void deleteAskpassHelper(Path helper)
    {
        if (helper == null) {
            return;
        }
        try {
            Files.deleteIfExists(helper);
        }
        catch (IOException e) {
            log.warn("Unable to delete askpass helper {}", helper, e);
        }
    }

    private static boolean isWindows()
    {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
