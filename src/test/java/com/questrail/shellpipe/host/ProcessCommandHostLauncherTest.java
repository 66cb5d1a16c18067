package com.questrail.shellpipe.host;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ProcessCommandHostLauncherTest
{
    private static final List<String> SHELL = List.of("/bin/sh", "-i");

    @Test
    void commandIsUsedAsIsWithoutCredentials() throws HostSpawnException
    {
        ProcessCommandHostLauncher launcher = new ProcessCommandHostLauncher(SHELL, Optional.empty(), false);
        assertEquals(SHELL, launcher.effectiveCommand());
    }

    @Test
    void credentialsWrapCommandInSudoOnUnix() throws HostSpawnException
    {
        ProcessCommandHostLauncher launcher = new ProcessCommandHostLauncher(
                SHELL, Optional.of(new HostCredentials("alice", "pw")), false, "sudo", "bob");

        assertEquals(List.of("sudo", "-A", "-k", "-u", "alice", "--", "/bin/sh", "-i"),
                launcher.effectiveCommand());
    }

    @Test
    void rootSwitchesIdentityWithoutPrompting() throws HostSpawnException
    {
        ProcessCommandHostLauncher launcher = new ProcessCommandHostLauncher(
                SHELL, Optional.of(new HostCredentials("alice", "pw")), false, "sudo", "root");

        assertEquals(List.of("sudo", "-n", "-k", "-u", "alice", "--", "/bin/sh", "-i"),
                launcher.effectiveCommand());
    }

    @Test
    void credentialsForCurrentUserLeaveCommandAlone() throws HostSpawnException
    {
        ProcessCommandHostLauncher launcher = new ProcessCommandHostLauncher(
                SHELL, Optional.of(new HostCredentials("alice", "pw")), false, "sudo", "alice");

        assertEquals(SHELL, launcher.effectiveCommand());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void passwordNeverReachesHostWhenSudoDoesNotPrompt(@TempDir Path dir) throws Exception
    {
        Path sudo = fakeSudo(dir, "");
        ProcessCommandHostLauncher launcher = new ProcessCommandHostLauncher(
                List.of("/bin/sh", "-c", "read line; echo \"shell got: $line\""),
                Optional.of(new HostCredentials("alice", "hunter2")), false, sudo.toString(), "bob");

        String text = converse(launcher.launch(), "hello\n");

        assertTrue(text.contains("shell got: hello"), text);
        assertFalse(text.contains("hunter2"), text);
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void promptingSudoGetsPasswordFromAskpassHelper(@TempDir Path dir) throws Exception
    {
        Path sudo = fakeSudo(dir,
                "echo \"askpass=$SUDO_ASKPASS\"\n"
                + "if [ \"$(\"$SUDO_ASKPASS\")\" = hunter2 ]; then echo authenticated; else echo denied; fi\n");
        ProcessCommandHostLauncher launcher = new ProcessCommandHostLauncher(
                List.of("/bin/sh", "-c", "read line; echo \"shell got: $line\""),
                Optional.of(new HostCredentials("alice", "hunter2")), false, sudo.toString(), "bob");

        CommandHost host = launcher.launch();
        String text = converse(host, "ls\n");

        assertTrue(text.contains("authenticated"), text);
        assertTrue(text.contains("shell got: ls"), text);
        assertFalse(text.contains("hunter2"), text);

        Path helper = Path.of(text.lines()
                .filter(line -> line.startsWith("askpass="))
                .findFirst()
                .orElseThrow()
                .substring("askpass=".length()));
        assertEquals(0, host.awaitExit(Duration.ofSeconds(5)).getAsInt());
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (Files.exists(helper) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(Files.exists(helper));
    }

    @Test
    void credentialsAreUnsupportedOnWindows()
    {
        ProcessCommandHostLauncher launcher = new ProcessCommandHostLauncher(
                List.of("powershell.exe"), Optional.of(new HostCredentials("alice", "pw", Optional.of("CORP"))), true);

        assertThrows(HostSpawnException.class, launcher::launch);
    }

    @Test
    void credentialsNeverAppearInToString()
    {
        assertFalse(new HostCredentials("alice", "hunter2").toString().contains("hunter2"));
    }

    @Test
    void emptyCommandIsRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new ProcessCommandHostLauncher(List.of(), Optional.empty()));
    }

    @Test
    void missingExecutableIsSpawnFailure()
    {
        ProcessCommandHostLauncher launcher = new ProcessCommandHostLauncher(
                List.of("/definitely/not/a/shell"), Optional.empty(), false);

        assertThrows(HostSpawnException.class, launcher::launch);
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void launchedHostEchoesInputAndMergesStderr() throws Exception
    {
        ProcessCommandHostLauncher launcher = new ProcessCommandHostLauncher(
                List.of("/bin/sh", "-c", "read line; echo \"out:$line\"; echo \"err:$line\" 1>&2"), Optional.empty());

        CommandHost host = launcher.launch();
        host.stdin().write("ping\n".getBytes(StandardCharsets.UTF_8));
        host.stdin().flush();

        BufferedReader out = new BufferedReader(new InputStreamReader(host.stdout(), StandardCharsets.UTF_8));
        assertEquals("out:ping", out.readLine());
        assertEquals("err:ping", out.readLine());
        assertNull(out.readLine());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (host.isAlive() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(host.isAlive());
        assertEquals(0, host.exitCode().getAsInt());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void destroyTerminatesARunningHost() throws Exception
    {
        CommandHost host = new ProcessCommandHostLauncher(List.of("/bin/sh", "-c", "sleep 30"), Optional.empty()).launch();
        assertTrue(host.isAlive());

        host.destroy();

        assertEquals(-1, host.stdout().read());
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (host.isAlive() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(host.isAlive());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void destroyedHostReportsExitCodeAfterWaiting() throws Exception
    {
        CommandHost host = new ProcessCommandHostLauncher(List.of("/bin/sh", "-c", "sleep 30"), Optional.empty()).launch();
        assertTrue(host.awaitExit(Duration.ofMillis(50)).isEmpty());

        host.destroy();

        assertTrue(host.awaitExit(Duration.ofSeconds(5)).isPresent());
    }

    /**
     * Writes a stand-in for sudo that runs {@code preamble}, skips its own
     * options and then execs the wrapped command.
     */
    private static Path fakeSudo(Path dir, String preamble) throws IOException
    {
        Path sudo = dir.resolve("sudo");
        Files.writeString(sudo, "#!/bin/sh\n" + preamble
                + "while [ \"$#\" -gt 0 ] && [ \"$1\" != \"--\" ]; do shift; done\n"
                + "shift\n"
                + "exec \"$@\"\n", StandardCharsets.US_ASCII);
        Files.setPosixFilePermissions(sudo, PosixFilePermissions.fromString("rwx------"));
        return sudo;
    }

    private static String converse(CommandHost host, String input) throws IOException
    {
        host.stdin().write(input.getBytes(StandardCharsets.UTF_8));
        host.stdin().close();
        return new String(host.stdout().readAllBytes(), StandardCharsets.UTF_8);
    }
}
