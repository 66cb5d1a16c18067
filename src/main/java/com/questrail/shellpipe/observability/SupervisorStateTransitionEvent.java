package com.questrail.shellpipe.observability;

import com.questrail.shellpipe.config.Role;
import com.questrail.shellpipe.supervisor.SupervisorState;

import java.time.Instant;

/**
 * Record representing a state change of a server or client supervisor.
 *
 * @param sealed whether the supervisor relays over the encrypted wire format
 */
public record SupervisorStateTransitionEvent(
    Instant timestamp,
    Role role,
    SupervisorState oldState,
    SupervisorState newState,
    boolean sealed
) {
}
