package com.ai.salescaller.exception;

/**
 * Webhook referenced a call id with no live session (stale, duplicate or already finished call).
 * Answered with HTTP 200 and a hangup so the telephony provider stops retrying.
 */
public class UnknownSessionException extends SalesCallerException {

    private final String callId;

    public UnknownSessionException(String callId) {
        super("No active session for call " + callId);
        this.callId = callId;
    }

    public String getCallId() {
        return callId;
    }
}
