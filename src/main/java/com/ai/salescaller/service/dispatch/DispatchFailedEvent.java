package com.ai.salescaller.service.dispatch;

/**
 * Published when a call outcome could not be delivered after all retries, or failed permanently.
 */
public class DispatchFailedEvent {

    private final CallOutcomeReport report;
    private final String stage;
    private final String reason;

    public DispatchFailedEvent(CallOutcomeReport report, String stage, String reason) {
        this.report = report;
        this.stage = stage;
        this.reason = reason;
    }

    public CallOutcomeReport getReport() {
        return report;
    }

    /** {@code record_store} or {@code workflow}. */
    public String getStage() {
        return stage;
    }

    public String getReason() {
        return reason;
    }
}
