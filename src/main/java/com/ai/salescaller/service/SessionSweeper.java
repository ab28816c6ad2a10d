package com.ai.salescaller.service;

import com.ai.salescaller.config.CallerProperties;
import com.ai.salescaller.conversation.CallOutcome;
import com.ai.salescaller.conversation.CallSession;
import com.ai.salescaller.exception.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Periodic TTL sweep. Live sessions idle past {@code caller.session-ttl} are ended as
 * {@code no_response} and dispatched; terminal ones still in the store (their dispatch failed or
 * was shed) are evicted. Finished call ids older than {@code caller.finished-call-retention} are
 * forgotten.
 */
@Component
public class SessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(SessionSweeper.class);

    private final SessionStore sessionStore;
    private final ConversationStateMachine stateMachine;
    private final CallerProperties properties;
    private final Clock clock;

    public SessionSweeper(SessionStore sessionStore,
                          ConversationStateMachine stateMachine,
                          CallerProperties properties,
                          Clock clock) {
        this.sessionStore = sessionStore;
        this.stateMachine = stateMachine;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "#{@callerProperties.sweepInterval.toMillis()}")
    public void sweep() {
        int forgotten = sessionStore.forgetFinishedBefore(clock.instant().minus(properties.getFinishedCallRetention()));
        if (forgotten > 0) {
            log.debug("Forgot {} finished call id(s)", forgotten);
        }
        List<CallSession> idle = sessionStore.idleSessions(clock.instant(), properties.getSessionTtl());
        if (idle.isEmpty()) {
            return;
        }
        int ended = 0;
        int evicted = 0;
        for (CallSession session : idle) {
            if (session.isTerminal()) {
                if (sessionStore.remove(session)) {
                    evicted++;
                }
                continue;
            }
            try {
                if (stateMachine.endCall(session.getCallId(), CallOutcome.NO_RESPONSE, null)) {
                    ended++;
                }
            } catch (UnknownSessionException e) {
                log.debug("[{}] Session left the store during the sweep", session.getCallId());
            }
        }
        log.info("Session sweep: {} abandoned call(s) ended, {} terminal session(s) evicted, {} remaining",
                ended, evicted, sessionStore.size());
    }
}
