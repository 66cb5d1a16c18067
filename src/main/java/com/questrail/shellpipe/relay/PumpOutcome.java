package com.questrail.shellpipe.relay;

/**
 * Why a pump stopped.
 */
public enum PumpOutcome
{
    /** The source reached end-of-stream. */
    END_OF_STREAM,

    /** Reading from or writing to the transport failed. */
    TRANSPORT_FAILURE,

    /** Reading from or writing to the local endpoint (command host or console) failed. */
    HOST_FAILURE,

    /** The session was already over when the pump checked; or the pump was cancelled. */
    STOPPED
}
