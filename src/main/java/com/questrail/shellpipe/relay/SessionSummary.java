package com.questrail.shellpipe.relay;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Outcome of one session, produced at teardown.
 *
 * @param sessionId sequence number of the session within its supervisor
 * @param reason what ended the session
 * @param outbound result of the outbound pump
 * @param inbound result of the inbound pump
 * @param hostExitCode exit code of the command host, if there was one and it exited
 * @param duration time from connect to end of teardown
 */
public record SessionSummary(
        long sessionId,
        TeardownReason reason,
        PumpResult outbound,
        PumpResult inbound,
        OptionalInt hostExitCode,
        Duration duration
) {
    public SessionSummary {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(outbound, "outbound");
        Objects.requireNonNull(inbound, "inbound");
        Objects.requireNonNull(hostExitCode, "hostExitCode");
        Objects.requireNonNull(duration, "duration");
    }
}
