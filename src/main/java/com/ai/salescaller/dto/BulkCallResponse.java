package com.ai.salescaller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Per-customer results of a bulk call request, in request order.
 */
@Getter
@AllArgsConstructor
public class BulkCallResponse {

    private final List<CustomerResult> results;
    private final int total;
    private final int successful;
    private final int failed;

    public static BulkCallResponse of(List<CustomerResult> results) {
        int successful = (int) results.stream().filter(CustomerResult::isSuccess).count();
        return new BulkCallResponse(results, results.size(), successful, results.size() - successful);
    }

    @Getter
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CustomerResult {

        private final String customerId;
        private final boolean success;
        private final String callSid;
        private final String error;

        public static CustomerResult placed(String customerId, String callSid) {
            return new CustomerResult(customerId, true, callSid, null);
        }

        public static CustomerResult failed(String customerId, String error) {
            return new CustomerResult(customerId, false, null, error);
        }
    }
}
