package com.ai.salescaller.dto;

import com.ai.salescaller.conversation.CallSession;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of one call for the call-management API. Build it under the session lock.
 */
@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallSummary {

    private final String callSid;
    private final String status;
    private final String customerId;
    private final String customerName;
    private final String step;
    private final Integer turnCount;
    private final Map<String, String> extractedData;
    private final Instant startedAt;
    private final Instant lastActivityAt;
    private final String outcome;

    public static CallSummary of(CallSession session) {
        return new CallSummary(
                session.getCallId(),
                session.isTerminal() ? "ended" : "active",
                session.getCustomerRef().getRecordKey(),
                session.getCustomer().getName(),
                session.getScriptStep().name(),
                session.getTurnHistory().size(),
                Map.copyOf(session.getExtractedData()),
                session.getCreatedAt(),
                session.getLastActivityAt(),
                session.isTerminal() ? session.getOutcome().wireName() : null);
    }

    /** A call whose session was already delivered and evicted. */
    public static CallSummary finished(String callSid) {
        return new CallSummary(callSid, "ended", null, null, null, null, null, null, null, null);
    }
}
