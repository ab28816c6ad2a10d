package com.ai.salescaller.conversation;

import com.ai.salescaller.dto.VoiceDirective;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-call conversation state. Maintains script position, collected answers and the transcript.
 *
 * <p>Mutations happen under {@link #getLock()}, taken by the session store. Once terminal the
 * session rejects every mutation except the one-shot {@link #markDispatched()}.
 */
public class CallSession {

    private final String callId;
    private final CustomerProfile customer;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();

    private ScriptStep scriptStep = ScriptStep.GREETING;
    private final Map<String, String> extractedData = new LinkedHashMap<>();
    private final List<Turn> turnHistory = new ArrayList<>();
    private final Map<ScriptStep, Integer> stepRetries = new EnumMap<>(ScriptStep.class);
    private int consecutiveFailures;
    private Instant lastActivityAt;
    private Instant endedAt;
    private boolean terminal;
    private CallOutcome outcome;
    private Integer reportedDurationSeconds;
    private VoiceDirective lastDirective;

    private volatile boolean hangupRequested;
    private final AtomicBoolean dispatched = new AtomicBoolean(false);

    public CallSession(String callId, CustomerProfile customer, Instant createdAt) {
        this.callId = Objects.requireNonNull(callId, "callId");
        this.customer = Objects.requireNonNull(customer, "customer");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActivityAt = createdAt;
    }

    public String getCallId() {
        return callId;
    }

    public CustomerProfile getCustomer() {
        return customer;
    }

    public CustomerRef getCustomerRef() {
        return customer.getRef();
    }

    public ReentrantLock getLock() {
        return lock;
    }

    public ScriptStep getScriptStep() {
        return scriptStep;
    }

    /**
     * Moves the script forward. Staying on the same step is allowed (re-prompt); going back is not.
     */
    public void moveTo(ScriptStep next) {
        requireLive();
        if (next.isBefore(scriptStep)) {
            throw new IllegalStateException("Backward transition " + scriptStep + " -> " + next + " for call " + callId);
        }
        scriptStep = next;
    }

    public Map<String, String> getExtractedData() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(extractedData));
    }

    public String getField(String key) {
        return extractedData.get(key);
    }

    /**
     * Records an answer. A field is written once per call; an {@code unknown} placeholder may be
     * corrected by a later, clearer answer.
     *
     * @return true when the value was stored
     */
    public boolean recordField(String key, String value) {
        requireLive();
        if (value == null) {
            return false;
        }
        String existing = extractedData.get(key);
        if (existing == null || (ExtractedFields.UNKNOWN.equals(existing) && !ExtractedFields.UNKNOWN.equals(value))) {
            extractedData.put(key, value);
            return true;
        }
        return false;
    }

    public List<Turn> getTurnHistory() {
        return Collections.unmodifiableList(new ArrayList<>(turnHistory));
    }

    public void appendTurn(Turn turn) {
        requireLive();
        turnHistory.add(turn);
    }

    public int retriesAt(ScriptStep step) {
        return stepRetries.getOrDefault(step, 0);
    }

    public int incrementRetries(ScriptStep step) {
        requireLive();
        return stepRetries.merge(step, 1, Integer::sum);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public int recordFailure() {
        requireLive();
        return ++consecutiveFailures;
    }

    public void clearFailures() {
        requireLive();
        consecutiveFailures = 0;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public void touch(Instant at) {
        if (!terminal) {
            lastActivityAt = at;
        }
    }

    public boolean isIdleSince(Instant now, Duration ttl) {
        return lastActivityAt.plus(ttl).isBefore(now);
    }

    public boolean isTerminal() {
        return terminal;
    }

    public CallOutcome getOutcome() {
        return outcome;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    /**
     * Freezes the session. The step becomes {@link ScriptStep#TERMINATED}.
     */
    public void terminate(CallOutcome finalOutcome, Instant at) {
        requireLive();
        this.scriptStep = ScriptStep.TERMINATED;
        this.outcome = Objects.requireNonNull(finalOutcome, "outcome");
        this.endedAt = at;
        this.lastActivityAt = at;
        this.terminal = true;
    }

    public Duration getDuration() {
        if (reportedDurationSeconds != null) {
            return Duration.ofSeconds(reportedDurationSeconds);
        }
        Instant end = endedAt != null ? endedAt : lastActivityAt;
        return Duration.between(createdAt, end);
    }

    /** Duration reported by the telephony provider, which wins over the locally measured one. */
    public void setReportedDurationSeconds(Integer seconds) {
        if (seconds != null && seconds >= 0) {
            this.reportedDurationSeconds = seconds;
        }
    }

    public VoiceDirective getLastDirective() {
        return lastDirective;
    }

    public void setLastDirective(VoiceDirective lastDirective) {
        this.lastDirective = lastDirective;
    }

    public boolean isHangupRequested() {
        return hangupRequested;
    }

    /** Set without the session lock so an in-flight turn can see the caller is gone. */
    public void requestHangup() {
        this.hangupRequested = true;
    }

    public boolean isDispatched() {
        return dispatched.get();
    }

    /**
     * @return true for exactly one caller per session
     */
    public boolean markDispatched() {
        return dispatched.compareAndSet(false, true);
    }

    private void requireLive() {
        if (terminal) {
            throw new IllegalStateException("Session " + callId + " is terminal");
        }
    }
}
