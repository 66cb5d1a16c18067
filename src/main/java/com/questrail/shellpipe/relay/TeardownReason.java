package com.questrail.shellpipe.relay;

/**
 * What ended a session, as observed when it was torn down.
 */
public enum TeardownReason
{
    /** A transport direction was no longer connected. */
    TRANSPORT_DISCONNECTED,

    /** The command host exited. */
    HOST_EXITED,

    /** A pump stopped while transport and host still looked healthy. */
    PUMP_TERMINATED,

    /** The local user ended the session (client: {@code exit} or end of input). */
    LOCAL_EXIT,

    /** The supervisor was asked to stop. */
    STOPPED
}
