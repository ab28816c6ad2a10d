package com.ai.salescaller.service.record;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * Fields written back to the customer's record when a call ends.
 */
@Getter
@Builder
public class OutcomeUpdate {

    private final String outcome;
    private final String nextAction;
    private final Map<String, String> extractedData;
    private final String email;
    private final String appointmentTime;
    private final long durationSeconds;
    private final String transcript;
    private final String notes;
    private final Instant calledAt;

    /** Customer status column derived from the outcome. */
    public String customerStatus() {
        switch (outcome) {
            case "appointment_scheduled":
                return "appointment_booked";
            case "not_interested":
                return "not_interested";
            case "interested_similar":
                return "interested_similar";
            case "callback_requested":
                return "callback";
            case "system_error":
                return "review";
            default:
                return "retry";
        }
    }
}
