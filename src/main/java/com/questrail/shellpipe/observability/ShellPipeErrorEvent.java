package com.questrail.shellpipe.observability;

import java.time.Instant;

/**
 * Record representing an error seen by a supervisor.
 */
public record ShellPipeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
