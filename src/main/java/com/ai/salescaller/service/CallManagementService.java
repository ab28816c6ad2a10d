package com.ai.salescaller.service;

import com.ai.salescaller.config.CallerProperties;
import com.ai.salescaller.conversation.CallSession;
import com.ai.salescaller.conversation.CustomerRef;
import com.ai.salescaller.dto.ActiveCallsResponse;
import com.ai.salescaller.dto.BulkCallResponse;
import com.ai.salescaller.dto.BulkCallResponse.CustomerResult;
import com.ai.salescaller.dto.CallSummary;
import com.ai.salescaller.dto.EndCallResponse;
import com.ai.salescaller.exception.ProviderException;
import com.ai.salescaller.exception.UnknownSessionException;
import com.ai.salescaller.service.dispatch.Sleeper;
import com.ai.salescaller.service.record.CustomerRecord;
import com.ai.salescaller.service.record.RecordStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Operator-facing call management: who is due a call, placing calls in bulk, and looking at or
 * ending calls in progress.
 */
@Service
public class CallManagementService {

    private static final Logger log = LoggerFactory.getLogger(CallManagementService.class);

    private final RecordStore recordStore;
    private final CallFlowService callFlowService;
    private final SessionStore sessionStore;
    private final CallerProperties properties;
    private final Sleeper sleeper;
    private final Clock clock;

    public CallManagementService(RecordStore recordStore,
                                 CallFlowService callFlowService,
                                 SessionStore sessionStore,
                                 CallerProperties properties,
                                 Sleeper sleeper,
                                 Clock clock) {
        this.recordStore = recordStore;
        this.callFlowService = callFlowService;
        this.sessionStore = sessionStore;
        this.properties = properties;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public List<CustomerRecord> readyCustomers() {
        return recordStore.findReadyToCall(LocalDate.now(clock));
    }

    /**
     * Calls each customer in turn, pausing {@code spacing} between placements. One customer's
     * failure does not stop the rest.
     *
     * @param spacing pause between calls, or null for {@code caller.bulk-call-spacing}
     * @throws IllegalArgumentException when more than {@code caller.bulk-max-customers} ids are given
     */
    public BulkCallResponse placeCalls(List<String> customerIds, Duration spacing) {
        if (customerIds.size() > properties.getBulkMaxCustomers()) {
            throw new IllegalArgumentException("At most " + properties.getBulkMaxCustomers() + " customers per request");
        }
        Duration pause = spacing != null ? spacing : properties.getBulkCallSpacing();
        log.info("Bulk call requested for {} customer(s), {}ms apart", customerIds.size(), pause.toMillis());

        List<CustomerResult> results = new ArrayList<>();
        boolean placedAny = false;
        for (int i = 0; i < customerIds.size(); i++) {
            String customerId = StringUtils.trimToEmpty(customerIds.get(i));
            if (placedAny && !pause.isZero()) {
                try {
                    sleeper.sleep(pause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Bulk call interrupted; {} customer(s) not called", customerIds.size() - i);
                    for (String skipped : customerIds.subList(i, customerIds.size())) {
                        results.add(CustomerResult.failed(skipped, "Not attempted: interrupted"));
                    }
                    break;
                }
            }
            CustomerResult result = placeCall(customerId);
            placedAny |= result.isSuccess();
            results.add(result);
        }

        BulkCallResponse response = BulkCallResponse.of(results);
        log.info("Bulk call done: {} placed, {} failed", response.getSuccessful(), response.getFailed());
        return response;
    }

    private CustomerResult placeCall(String customerId) {
        if (customerId.isEmpty()) {
            return CustomerResult.failed(customerId, "Blank customer id");
        }
        try {
            Optional<CustomerRecord> customer = recordStore.getCustomer(new CustomerRef(null, customerId));
            if (customer.isEmpty()) {
                return CustomerResult.failed(customerId, "Customer not found");
            }
            if (StringUtils.isBlank(customer.get().getPhone())) {
                return CustomerResult.failed(customerId, "Customer has no phone number");
            }
            String callSid = callFlowService.placeCall(customer.get());
            log.info("[{}] Bulk call placed for {}", callSid, customerId);
            return CustomerResult.placed(customerId, callSid);
        } catch (ProviderException e) {
            log.warn("Bulk call for {} failed: provider={} {}", customerId, e.getProvider(), e.getMessage());
            return CustomerResult.failed(customerId, e.getMessage());
        }
    }

    public ActiveCallsResponse activeCalls() {
        List<CallSummary> calls = new ArrayList<>();
        for (CallSession session : sessionStore.liveSessions()) {
            snapshot(session.getCallId()).filter(c -> "active".equals(c.getStatus())).ifPresent(calls::add);
        }
        Map<String, Long> byStep = calls.stream()
                .collect(Collectors.groupingBy(CallSummary::getStep, TreeMap::new, Collectors.counting()));
        double averageTurns = calls.stream().mapToInt(CallSummary::getTurnCount).average().orElse(0.0);
        return new ActiveCallsResponse(calls.size(), averageTurns, byStep, calls);
    }

    /**
     * Current state of a call; a call that finished and was already delivered reports only that it ended.
     */
    public Optional<CallSummary> callStatus(String callSid) {
        Optional<CallSummary> live = snapshot(callSid);
        if (live.isPresent()) {
            return live;
        }
        return sessionStore.isFinished(callSid) ? Optional.of(CallSummary.finished(callSid)) : Optional.empty();
    }

    /**
     * Hangs up a call in progress and ends its session.
     *
     * @throws UnknownSessionException when the call has no live session
     */
    public EndCallResponse endCall(String callSid) {
        CallSession session = sessionStore.find(callSid).orElseThrow(() -> new UnknownSessionException(callSid));
        boolean providerHangup = callFlowService.endCall(callSid);
        log.info("[{}] Ended on operator request", callSid);
        return new EndCallResponse(callSid, providerHangup, session.getOutcome().wireName());
    }

    private Optional<CallSummary> snapshot(String callSid) {
        try {
            return Optional.of(sessionStore.withSession(callSid, CallSummary::of));
        } catch (UnknownSessionException e) {
            log.debug("[{}] Session evicted while reading it", callSid);
            return Optional.empty();
        }
    }
}
