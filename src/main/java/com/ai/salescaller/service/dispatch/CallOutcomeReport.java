package com.ai.salescaller.service.dispatch;

import com.ai.salescaller.conversation.CallOutcome;
import com.ai.salescaller.conversation.CustomerRef;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a finished call, taken under the session lock and handed to the dispatch workers.
 */
@Getter
@Builder
public class CallOutcomeReport {

    private final String callId;
    private final CustomerRef customerRef;
    private final String customerName;
    private final String carModel;
    private final Map<String, String> extractedData;
    private final String transcript;
    private final long durationSeconds;
    private final CallOutcome outcome;
    private final String nextAction;
    private final String callNotes;
    private final Instant endedAt;

    /**
     * Workflow event body: {@code {event, timestamp, data}}.
     */
    public Map<String, Object> toWorkflowPayload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("call_sid", callId);
        data.put("customer_ref", customerRef.getRecordKey());
        data.put("phone_number", customerRef.getPhone());
        data.put("customer_name", customerName);
        data.put("car_model", carModel);
        data.put("extracted_data", extractedData);
        data.put("transcript", transcript);
        data.put("call_duration", durationSeconds);
        data.put("outcome", outcome.wireName());
        data.put("next_action", nextAction);
        data.put("call_notes", callNotes);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", outcome.eventName());
        payload.put("timestamp", endedAt.toString());
        payload.put("data", data);
        return payload;
    }
}
