package com.ai.salescaller.service.dispatch;

import com.ai.salescaller.config.DispatchProperties;
import com.ai.salescaller.conversation.CallSession;
import com.ai.salescaller.exception.ProviderException;
import com.ai.salescaller.service.SessionStore;
import com.ai.salescaller.service.record.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Reports finished calls to the record store and the workflow engine off the webhook threads.
 *
 * <p>Jobs run on the {@code dispatchExecutor} pool, which sheds its oldest queued job when full so a
 * slow downstream never blocks a webhook. Writes for the same customer are serialized. The record
 * store update and the workflow notification are independent stages: each has its own retries, a
 * stage that fails permanently or runs out of retries publishes its own {@link DispatchFailedEvent},
 * and the session is removed from the store only when both stages succeed.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    static final String MDC_CALL_SID = "callSid";
    static final String STAGE_RECORD_STORE = "record_store";
    static final String STAGE_WORKFLOW = "workflow";
    private static final int CUSTOMER_LOCK_STRIPES = 64;

    private final CallOutcomeReportFactory reportFactory;
    private final RecordStore recordStore;
    private final WorkflowClient workflowClient;
    private final BackoffRetrier retrier;
    private final SessionStore sessionStore;
    private final ApplicationEventPublisher publisher;
    private final ThreadPoolTaskExecutor executor;
    private final ReentrantLock[] customerLocks = new ReentrantLock[CUSTOMER_LOCK_STRIPES];

    public NotificationDispatcher(DispatchProperties properties,
                                  CallOutcomeReportFactory reportFactory,
                                  RecordStore recordStore,
                                  WorkflowClient workflowClient,
                                  BackoffRetrier retrier,
                                  SessionStore sessionStore,
                                  ApplicationEventPublisher publisher,
                                  @Qualifier("dispatchExecutor") ThreadPoolTaskExecutor executor) {
        this.reportFactory = reportFactory;
        this.recordStore = recordStore;
        this.workflowClient = workflowClient;
        this.retrier = retrier;
        this.sessionStore = sessionStore;
        this.publisher = publisher;
        this.executor = executor;
        for (int i = 0; i < customerLocks.length; i++) {
            customerLocks[i] = new ReentrantLock();
        }
        log.info("Dispatcher started: workers={} queueCapacity={} workflow={}",
                executor.getMaxPoolSize(), properties.getQueueCapacity(),
                workflowClient.isEnabled() ? "enabled" : "disabled");
    }

    /**
     * Snapshots the terminal session and queues its report. Called once per session, under its lock.
     */
    public void dispatch(CallSession session) {
        CallOutcomeReport report = reportFactory.from(session);
        executor.execute(new DispatchJob(report, session));
        log.debug("[{}] Dispatch queued (queue size {})", report.getCallId(), executor.getThreadPoolExecutor().getQueue().size());
    }

    private void deliver(CallOutcomeReport report, CallSession session) {
        String callId = report.getCallId();
        boolean recorded;
        ReentrantLock lock = lockFor(report.getCustomerRef().getRecordKey());
        lock.lock();
        try {
            recorded = runStage(report, STAGE_RECORD_STORE, "[" + callId + "] record store update",
                    () -> recordStore.updateOutcome(report.getCustomerRef(), callId, reportFactory.toUpdate(report)));
        } finally {
            lock.unlock();
        }
        boolean notified = runStage(report, STAGE_WORKFLOW, "[" + callId + "] workflow notification",
                () -> workflowClient.post(report));
        if (recorded && notified) {
            sessionStore.remove(session);
            log.info("[{}] Outcome {} delivered ({})", callId, report.getOutcome().wireName(), report.getNextAction());
        }
    }

    private boolean runStage(CallOutcomeReport report, String stage, String what, BackoffRetrier.RetryableOperation operation) {
        try {
            retrier.run(what, operation);
            return true;
        } catch (ProviderException e) {
            fail(report, stage, (e.isRetryable() ? "retries exhausted: " : "permanent: ") + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected dispatch failure at {}", report.getCallId(), stage, e);
            fail(report, stage, "unexpected: " + e);
        }
        return false;
    }

    private void fail(CallOutcomeReport report, String stage, String reason) {
        log.error("[{}] Dispatch failed at {} ({}); manual follow-up needed", report.getCallId(), stage, reason);
        publisher.publishEvent(new DispatchFailedEvent(report, stage, reason));
    }

    private ReentrantLock lockFor(String customerKey) {
        return customerLocks[Math.floorMod(customerKey.hashCode(), customerLocks.length)];
    }

    private final class DispatchJob implements Runnable {
        private final CallOutcomeReport report;
        private final CallSession session;

        DispatchJob(CallOutcomeReport report, CallSession session) {
            this.report = report;
            this.session = session;
        }

        @Override
        public void run() {
            // dispatch() may come from the sweeper, which carries no callSid
            MDC.put(MDC_CALL_SID, report.getCallId());
            deliver(report, session);
        }

        @Override
        public String toString() {
            return "dispatch[" + report.getCallId() + "/" + report.getOutcome().wireName() + "]";
        }
    }
}
