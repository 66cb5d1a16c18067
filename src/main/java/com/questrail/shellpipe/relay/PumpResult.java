package com.questrail.shellpipe.relay;

import java.util.Objects;
import java.util.Optional;

/**
 * Final report of one pump, inspected by the supervisor at teardown.
 *
 * @param direction which pump this is
 * @param outcome why it stopped
 * @param unitsRelayed units forwarded to the sink
 * @param unitsDropped units read but discarded by the source
 * @param failure the exception behind a failure outcome; {@code null} otherwise
 */
public record PumpResult(
        PumpDirection direction,
        PumpOutcome outcome,
        long unitsRelayed,
        long unitsDropped,
        Throwable failure
) {
    public PumpResult {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(outcome, "outcome");
    }

    public static PumpResult stopped(PumpDirection direction) {
        return new PumpResult(direction, PumpOutcome.STOPPED, 0, 0, null);
    }

    public boolean isFailure() {
        return outcome == PumpOutcome.TRANSPORT_FAILURE || outcome == PumpOutcome.HOST_FAILURE;
    }

    public Optional<Throwable> failureCause() {
        return Optional.ofNullable(failure);
    }
}
