package com.ai.salescaller.service.speech;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-provider breaker. {@code failureThreshold} failures inside {@code window} open it; while open
 * the provider is skipped. After {@code coolDown} a single trial request is let through: success
 * closes the breaker, failure re-opens it for another cool-down.
 */
public class ProviderCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private final String provider;
    private final int failureThreshold;
    private final Duration window;
    private final Duration coolDown;
    private final Clock clock;

    private final Deque<Instant> failures = new ArrayDeque<>();
    private State state = State.CLOSED;
    private Instant openedAt;
    private boolean trialInFlight;

    public ProviderCircuitBreaker(String provider, int failureThreshold, Duration window, Duration coolDown, Clock clock) {
        this.provider = provider;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.window = window;
        this.coolDown = coolDown;
        this.clock = clock;
    }

    /**
     * @return true when the caller may use the provider now; a true answer in half-open state
     * reserves the single trial slot
     */
    public synchronized boolean tryAcquire() {
        if (state == State.CLOSED) {
            return true;
        }
        Instant now = clock.instant();
        if (state == State.OPEN && !now.isBefore(openedAt.plus(coolDown))) {
            state = State.HALF_OPEN;
            trialInFlight = false;
            log.info("Circuit for {} half-open, allowing a trial request", provider);
        }
        if (state == State.HALF_OPEN && !trialInFlight) {
            trialInFlight = true;
            return true;
        }
        return false;
    }

    public synchronized void recordSuccess() {
        if (state != State.CLOSED) {
            log.info("Circuit for {} closed", provider);
        }
        state = State.CLOSED;
        trialInFlight = false;
        failures.clear();
    }

    public synchronized void recordFailure() {
        Instant now = clock.instant();
        if (state == State.HALF_OPEN) {
            open(now);
            return;
        }
        failures.addLast(now);
        Instant horizon = now.minus(window);
        while (!failures.isEmpty() && failures.peekFirst().isBefore(horizon)) {
            failures.removeFirst();
        }
        if (state == State.CLOSED && failures.size() >= failureThreshold) {
            open(now);
        }
    }

    public synchronized State getState() {
        return state;
    }

    public String getProvider() {
        return provider;
    }

    private void open(Instant now) {
        state = State.OPEN;
        openedAt = now;
        trialInFlight = false;
        failures.clear();
        log.warn("Circuit for {} opened until {}", provider, now.plus(coolDown));
    }
}
