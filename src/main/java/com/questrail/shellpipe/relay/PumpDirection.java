package com.questrail.shellpipe.relay;

/**
 * Direction of a pump relative to the local endpoint.
 */
public enum PumpDirection
{
    /** Local endpoint (command host output, console) to transport. */
    OUTBOUND(PumpOutcome.HOST_FAILURE, PumpOutcome.TRANSPORT_FAILURE),

    /** Transport to local endpoint (command host input, display). */
    INBOUND(PumpOutcome.TRANSPORT_FAILURE, PumpOutcome.HOST_FAILURE);

    private final PumpOutcome sourceFailure;
    private final PumpOutcome sinkFailure;

    PumpDirection(PumpOutcome sourceFailure, PumpOutcome sinkFailure)
    {
        this.sourceFailure = sourceFailure;
        this.sinkFailure = sinkFailure;
    }

    PumpOutcome sourceFailure()
    {
        return sourceFailure;
    }

    PumpOutcome sinkFailure()
    {
        return sinkFailure;
    }
}
