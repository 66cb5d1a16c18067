package com.questrail.shellpipe.supervisor;

/**
 * Lifecycle states of the server and client supervisors.
 *
 * <pre>
 * server: IDLE → SPAWNING_HOST → WAITING_FOR_PEER → CONNECTED → TEARDOWN → IDLE ...
 * client: CONNECTING → CONNECTED → TEARDOWN → TERMINAL
 * </pre>
 *
 * A server reaches {@link #TERMINAL} only when it is stopped or cannot
 * spawn its command host.
 */
public enum SupervisorState
{
    IDLE,
    SPAWNING_HOST,
    WAITING_FOR_PEER,
    CONNECTING,
    CONNECTED,
    TEARDOWN,
    TERMINAL
}
