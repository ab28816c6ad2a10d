package com.ai.salescaller.controller;

import com.ai.salescaller.dto.ActiveCallsResponse;
import com.ai.salescaller.dto.BulkCallRequest;
import com.ai.salescaller.dto.BulkCallResponse;
import com.ai.salescaller.dto.CallSummary;
import com.ai.salescaller.dto.EndCallResponse;
import com.ai.salescaller.dto.OutboundCallRequest;
import com.ai.salescaller.dto.OutboundCallResponse;
import com.ai.salescaller.dto.ReadyCustomersResponse;
import com.ai.salescaller.exception.UnknownSessionException;
import com.ai.salescaller.service.CallFlowService;
import com.ai.salescaller.service.CallManagementService;
import com.ai.salescaller.service.record.CustomerRecord;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * Starts outbound sales calls and lets an operator follow and end them.
 */
@RestController
public class CallController {

    private static final Logger log = LoggerFactory.getLogger(CallController.class);

    private final CallFlowService callFlowService;
    private final CallManagementService callManagementService;

    public CallController(CallFlowService callFlowService, CallManagementService callManagementService) {
        this.callFlowService = callFlowService;
        this.callManagementService = callManagementService;
    }

    @PostMapping("/calls")
    public ResponseEntity<OutboundCallResponse> placeCall(@Valid @RequestBody OutboundCallRequest request) {
        String callSid = callFlowService.placeCall(request.getPhoneNumber());
        log.info("[{}] Call requested", callSid);
        return ResponseEntity.accepted().body(new OutboundCallResponse(callSid, request.getPhoneNumber(), "initiated"));
    }

    /**
     * Places one call per customer id, paced. Always 200; per-customer failures are in the body.
     */
    @PostMapping("/calls/bulk")
    public ResponseEntity<BulkCallResponse> placeCalls(@Valid @RequestBody BulkCallRequest request) {
        Duration spacing = request.getDelayMs() == null ? null : Duration.ofMillis(request.getDelayMs());
        return ResponseEntity.ok(callManagementService.placeCalls(request.getCustomerIds(), spacing));
    }

    @GetMapping("/customers/ready")
    public ResponseEntity<ReadyCustomersResponse> readyCustomers() {
        List<CustomerRecord> customers = callManagementService.readyCustomers();
        return ResponseEntity.ok(new ReadyCustomersResponse(customers, customers.size()));
    }

    @GetMapping("/calls/active")
    public ResponseEntity<ActiveCallsResponse> activeCalls() {
        return ResponseEntity.ok(callManagementService.activeCalls());
    }

    @GetMapping("/calls/{callSid}")
    public ResponseEntity<CallSummary> callStatus(@PathVariable String callSid) {
        CallSummary summary = callManagementService.callStatus(callSid)
                .orElseThrow(() -> new UnknownSessionException(callSid));
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/calls/{callSid}/end")
    public ResponseEntity<EndCallResponse> endCall(@PathVariable String callSid) {
        return ResponseEntity.ok(callManagementService.endCall(callSid));
    }
}
