package com.questrail.shellpipe.observability;

import com.questrail.shellpipe.config.Role;
import com.questrail.shellpipe.relay.SessionSummary;

import java.time.Instant;

/**
 * Record representing the end of a session.
 */
public record SessionClosedEvent(
    Instant timestamp,
    Role role,
    SessionSummary summary
) {
}
