package com.questrail.shellpipe.observability;

/**
 * No-op implementation of ShellPipeObservabilitySink.
 */
public final class NullObservabilitySink implements ShellPipeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(SupervisorStateTransitionEvent event) {}

    @Override
    public void onSessionClosed(SessionClosedEvent event) {}

    @Override
    public void onError(ShellPipeErrorEvent event) {}
}
