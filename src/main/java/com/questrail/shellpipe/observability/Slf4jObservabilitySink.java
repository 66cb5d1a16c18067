package com.questrail.shellpipe.observability;

import com.questrail.shellpipe.config.Role;
import com.questrail.shellpipe.relay.SessionSummary;
import com.questrail.shellpipe.supervisor.SupervisorState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ShellPipeObservabilitySink that emits the
 * operator status lines via SLF4J.
 */
public final class Slf4jObservabilitySink implements ShellPipeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onStateTransition(SupervisorStateTransitionEvent event) {
        SupervisorState next = event.newState();
        if (event.role() == Role.SERVER) {
            switch (next) {
                case WAITING_FOR_PEER -> log.info("Waiting for peer...");
                case CONNECTED -> log.info("Peer connected!");
                case TEARDOWN -> log.info("Peer disconnected!");
                default -> log.debug("Server state: {} -> {}", event.oldState(), next);
            }
        }
        else {
            switch (next) {
                case CONNECTING -> log.info("Establishing {} connection to remote system...",
                        event.sealed() ? "a secure" : "an unsecure");
                case CONNECTED -> log.info("Connected.");
                case TERMINAL -> log.info("Session with remote host is now terminated.");
                default -> log.debug("Client state: {} -> {}", event.oldState(), next);
            }
        }
    }

    @Override
    public void onSessionClosed(SessionClosedEvent event) {
        SessionSummary s = event.summary();
        log.debug("{} session {} closed: reason={}, outbound={}/{} (dropped {}), inbound={}/{} (dropped {}), duration={}",
            event.role(),
            s.sessionId(),
            s.reason(),
            s.outbound().outcome(), s.outbound().unitsRelayed(), s.outbound().unitsDropped(),
            s.inbound().outcome(), s.inbound().unitsRelayed(), s.inbound().unitsDropped(),
            s.duration());
    }

    @Override
    public void onError(ShellPipeErrorEvent event) {
        log.error("{}", event.message(), event.cause());
    }
}
