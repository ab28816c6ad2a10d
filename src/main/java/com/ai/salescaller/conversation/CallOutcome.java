package com.ai.salescaller.conversation;

import java.util.Map;

/**
 * Final classification of a call, reported downstream together with the next action the workflow should take.
 */
public enum CallOutcome {
    APPOINTMENT_SCHEDULED("appointment_scheduled"),
    INTERESTED_SIMILAR("interested_similar"),
    CALLBACK_REQUESTED("callback_requested"),
    NOT_INTERESTED("not_interested"),
    NO_RESPONSE("no_response"),
    CALL_FAILED("call_failed"),
    SYSTEM_ERROR("system_error");

    private final String wireName;

    CallOutcome(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public String nextAction(Map<String, String> extractedData) {
        switch (this) {
            case APPOINTMENT_SCHEDULED:
                return "send_appointment_confirmation";
            case INTERESTED_SIMILAR:
                return "send_similar_cars_email";
            case CALLBACK_REQUESTED:
                return "schedule_callback";
            case NOT_INTERESTED:
                return extractedData != null && extractedData.containsKey(ExtractedFields.EMAIL)
                        ? "add_to_nurture_campaign"
                        : "mark_as_closed";
            case NO_RESPONSE:
            case CALL_FAILED:
                return "schedule_retry_call";
            case SYSTEM_ERROR:
            default:
                return "manual_review_required";
        }
    }

    /** Workflow event name for this outcome. */
    public String eventName() {
        return this == CALL_FAILED || this == SYSTEM_ERROR ? "call_failed" : "call_completed";
    }

    /**
     * Derives the outcome of a call that reached the end of the script from what the customer said.
     */
    public static CallOutcome fromExtractedData(Map<String, String> data) {
        if (ExtractedFields.NO.equals(data.get(ExtractedFields.GOOD_TIME_TO_TALK))
                && !data.containsKey(ExtractedFields.STILL_INTERESTED)) {
            return CALLBACK_REQUESTED;
        }
        if (data.containsKey(ExtractedFields.APPOINTMENT_TIME)) {
            return APPOINTMENT_SCHEDULED;
        }
        if (ExtractedFields.YES.equals(data.get(ExtractedFields.WANTS_APPOINTMENT))) {
            // wanted a visit but never gave a usable time
            return CALLBACK_REQUESTED;
        }
        if (ExtractedFields.YES.equals(data.get(ExtractedFields.WANTS_SIMILAR))) {
            return INTERESTED_SIMILAR;
        }
        if (ExtractedFields.NO.equals(data.get(ExtractedFields.STILL_INTERESTED))
                || ExtractedFields.NO.equals(data.get(ExtractedFields.WANTS_SIMILAR))) {
            return NOT_INTERESTED;
        }
        return NO_RESPONSE;
    }
}
