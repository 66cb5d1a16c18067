package com.questrail.shellpipe.config;

import java.time.Duration;
import java.util.Objects;

/**
 * RelayTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the supervisors. None of these values affect what is
 * relayed, only when the supervisors look at a session and how long they wait
 * for it to wind down.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>livenessPollInterval</b>: period at which a connected session is
 *       checked for a disconnected channel, an exited host or a stopped pump.
 *       Teardown starts at most one interval after any of these.</li>
 *   <li><b>exitGraceDelay</b>: client only. Pause after sending {@code exit}
 *       so the remote host can flush its last output before teardown.</li>
 *   <li><b>pumpJoinTimeout</b>: upper bound on waiting for each pump during
 *       teardown. A pump still running afterwards is cancelled.</li>
 *   <li><b>acceptRetryDelay</b>: server only. Pause before the next session
 *       after accepting a peer failed.</li>
 * </ul>
 */
public record RelayTimingPolicy(
        Duration livenessPollInterval,
        Duration exitGraceDelay,
        Duration pumpJoinTimeout,
        Duration acceptRetryDelay
) {
    public RelayTimingPolicy {
        Objects.requireNonNull(livenessPollInterval, "livenessPollInterval");
        Objects.requireNonNull(exitGraceDelay, "exitGraceDelay");
        Objects.requireNonNull(pumpJoinTimeout, "pumpJoinTimeout");
        Objects.requireNonNull(acceptRetryDelay, "acceptRetryDelay");

        if (livenessPollInterval.isNegative() || livenessPollInterval.isZero()) {
            throw new IllegalArgumentException("livenessPollInterval must be positive");
        }
        if (exitGraceDelay.isNegative()) {
            throw new IllegalArgumentException("exitGraceDelay must be non-negative");
        }
        if (pumpJoinTimeout.isNegative()) {
            throw new IllegalArgumentException("pumpJoinTimeout must be non-negative");
        }
        if (acceptRetryDelay.isNegative()) {
            throw new IllegalArgumentException("acceptRetryDelay must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>livenessPollInterval: 100ms</li>
     *   <li>exitGraceDelay: 500ms</li>
     *   <li>pumpJoinTimeout: 5s</li>
     *   <li>acceptRetryDelay: 1s</li>
     * </ul>
     */
    public static RelayTimingPolicy defaults() {
        return new RelayTimingPolicy(
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofSeconds(5),
                Duration.ofSeconds(1)
        );
    }

    public RelayTimingPolicy withLivenessPollInterval(Duration interval) {
        return new RelayTimingPolicy(interval, exitGraceDelay, pumpJoinTimeout, acceptRetryDelay);
    }

    public RelayTimingPolicy withExitGraceDelay(Duration delay) {
        return new RelayTimingPolicy(livenessPollInterval, delay, pumpJoinTimeout, acceptRetryDelay);
    }
}
