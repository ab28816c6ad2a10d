package com.ai.salescaller.service.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Audit trail for undelivered outcomes: one ERROR line per failure with everything needed to
 * follow up by hand.
 */
@Component
public class DispatchFailureLogger {

    private static final Logger log = LoggerFactory.getLogger(DispatchFailureLogger.class);

    private final AtomicLong failures = new AtomicLong();

    @EventListener
    public void onDispatchFailed(DispatchFailedEvent event) {
        failures.incrementAndGet();
        CallOutcomeReport r = event.getReport();
        log.error("Manual follow-up required: call={} customer={} outcome={} next_action={} stage={} reason={}",
                r.getCallId(), r.getCustomerRef().getRecordKey(), r.getOutcome().wireName(), r.getNextAction(),
                event.getStage(), event.getReason());
    }

    public long getFailureCount() {
        return failures.get();
    }
}
