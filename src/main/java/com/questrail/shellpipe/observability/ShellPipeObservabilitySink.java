package com.questrail.shellpipe.observability;

/**
 * Receives lifecycle events from the supervisors.
 * Implementations can provide logging, metrics, or console status output.
 */
public interface ShellPipeObservabilitySink {
    /**
     * Called when a supervisor changes state.
     * @param event the transition details
     */
    void onStateTransition(SupervisorStateTransitionEvent event);

    /**
     * Called after a session has been torn down.
     * @param event the session outcome
     */
    void onSessionClosed(SessionClosedEvent event);

    /**
     * Called when an error ends or disrupts a supervisor loop.
     * @param event the error event
     */
    void onError(ShellPipeErrorEvent event);
}
