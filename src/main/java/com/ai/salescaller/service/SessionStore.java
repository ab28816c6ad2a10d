package com.ai.salescaller.service;

import com.ai.salescaller.conversation.CallSession;
import com.ai.salescaller.exception.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Process-local map of call id to live session.
 *
 * <p>Get-or-create is atomic, so a webhook retry can never produce a second session for a call.
 * All mutations go through {@link #withSession}, which serializes concurrent webhooks for the
 * same call behind the session's lock; different calls never contend.
 *
 * <p>Ids of calls that finished and were evicted are remembered for a while (at most
 * {@value #MAX_FINISHED_CALLS} of them), so a late webhook for such a call is not mistaken for a
 * new one.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    static final int MAX_FINISHED_CALLS = 10_000;

    private final Map<String, CallSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Instant> finishedCalls = Collections.synchronizedMap(
            new LinkedHashMap<String, Instant>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                    return size() > MAX_FINISHED_CALLS;
                }
            });

    public static final class Lookup {
        private final CallSession session;
        private final boolean created;

        Lookup(CallSession session, boolean created) {
            this.session = session;
            this.created = created;
        }

        public CallSession getSession() {
            return session;
        }

        /** False when another delivery of the same webhook got there first. */
        public boolean isCreated() {
            return created;
        }
    }

    public Lookup getOrCreate(String callId, Supplier<CallSession> factory) {
        boolean[] created = {false};
        CallSession session = sessions.computeIfAbsent(callId, id -> {
            created[0] = true;
            return factory.get();
        });
        if (created[0]) {
            log.info("[{}] Session created for {}", callId, session.getCustomerRef());
        }
        return new Lookup(session, created[0]);
    }

    public Optional<CallSession> find(String callId) {
        if (callId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(callId));
    }

    /**
     * Runs {@code action} while holding the session's lock.
     *
     * @throws UnknownSessionException when no session exists for the call
     */
    public <T> T withSession(String callId, Function<CallSession, T> action) {
        CallSession session = find(callId).orElseThrow(() -> new UnknownSessionException(callId));
        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            return action.apply(session);
        } finally {
            lock.unlock();
        }
    }

    /** Removes the mapping only if it still points at this exact session. */
    public boolean remove(CallSession session) {
        boolean removed = sessions.remove(session.getCallId(), session);
        if (removed && session.isTerminal()) {
            finishedCalls.put(session.getCallId(), session.getEndedAt());
        }
        if (removed) {
            log.debug("[{}] Session evicted", session.getCallId());
        }
        return removed;
    }

    /** True when the call already ended and its session was evicted. */
    public boolean isFinished(String callId) {
        return callId != null && finishedCalls.containsKey(callId);
    }

    /**
     * Forgets finished calls that ended before {@code horizon}.
     *
     * @return how many ids were dropped
     */
    public int forgetFinishedBefore(Instant horizon) {
        synchronized (finishedCalls) {
            int before = finishedCalls.size();
            finishedCalls.values().removeIf(endedAt -> endedAt.isBefore(horizon));
            return before - finishedCalls.size();
        }
    }

    public List<CallSession> idleSessions(Instant now, Duration ttl) {
        return sessions.values().stream()
                .filter(s -> s.isIdleSince(now, ttl))
                .collect(Collectors.toList());
    }

    /** Sessions of calls still in progress, oldest first. */
    public List<CallSession> liveSessions() {
        return sessions.values().stream()
                .filter(s -> !s.isTerminal())
                .sorted(Comparator.comparing(CallSession::getCreatedAt))
                .collect(Collectors.toList());
    }

    public int size() {
        return sessions.size();
    }
}
