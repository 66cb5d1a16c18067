package com.questrail.shellpipe.cli;

import picocli.CommandLine;

/**
 * Process entry point.
 */
public final class ShellPipeCli {

    private ShellPipeCli() {
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ShellPipeCommand()).execute(args);
        System.exit(exitCode);
    }
}
