package com.ai.salescaller.controller;

import com.ai.salescaller.dto.ActiveCallsResponse;
import com.ai.salescaller.dto.BulkCallResponse;
import com.ai.salescaller.dto.CallSummary;
import com.ai.salescaller.dto.EndCallResponse;
import com.ai.salescaller.exception.PermanentProviderException;
import com.ai.salescaller.exception.TransientProviderException;
import com.ai.salescaller.exception.UnknownSessionException;
import com.ai.salescaller.service.CallFlowService;
import com.ai.salescaller.service.CallManagementService;
import com.ai.salescaller.service.TwimlRenderer;
import com.ai.salescaller.service.record.CustomerRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CallController.class)
class CallControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CallFlowService callFlowService;

    @MockBean
    private CallManagementService callManagementService;

    @MockBean
    private TwimlRenderer twimlRenderer;

    @Test
    void shouldAcceptValidCallRequest() throws Exception {
        when(callFlowService.placeCall("+15551230001")).thenReturn("CA100");

        mockMvc.perform(post("/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"+15551230001\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.callSid").value("CA100"))
                .andExpect(jsonPath("$.phoneNumber").value("+15551230001"))
                .andExpect(jsonPath("$.status").value("initiated"));
    }

    @Test
    void shouldRejectMissingPhoneNumber() throws Exception {
        mockMvc.perform(post("/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));

        verify(callFlowService, never()).placeCall(anyString());
    }

    @Test
    void shouldRejectMalformedPhoneNumber() throws Exception {
        mockMvc.perform(post("/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"call me maybe\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRejectBodyThatIsNotJson() throws Exception {
        mockMvc.perform(post("/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("phoneNumber=+15551230001"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("Body must be JSON"));
    }

    @Test
    void shouldMapRejectedPlacementToBadGateway() throws Exception {
        when(callFlowService.placeCall(anyString()))
                .thenThrow(new PermanentProviderException("twilio", "HTTP 400", 400, null));

        mockMvc.perform(post("/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"+15551230001\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("PermanentProviderException"));
    }

    @Test
    void shouldMapUnreachableProviderToServiceUnavailable() throws Exception {
        when(callFlowService.placeCall(anyString()))
                .thenThrow(new TransientProviderException("twilio", "I/O failure"));

        mockMvc.perform(post("/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"+15551230001\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.details").value("Please retry in a few seconds"));
    }

    @Test
    void shouldReportPerCustomerResultsOfBulkCall() throws Exception {
        when(callManagementService.placeCalls(eq(List.of("CUST001", "CUST404")), isNull()))
                .thenReturn(BulkCallResponse.of(List.of(
                        BulkCallResponse.CustomerResult.placed("CUST001", "CA1"),
                        BulkCallResponse.CustomerResult.failed("CUST404", "Customer not found"))));

        mockMvc.perform(post("/calls/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerIds\":[\"CUST001\",\"CUST404\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.successful").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.results[0].callSid").value("CA1"))
                .andExpect(jsonPath("$.results[1].success").value(false))
                .andExpect(jsonPath("$.results[1].error").value("Customer not found"))
                .andExpect(jsonPath("$.results[1].callSid").doesNotExist());
    }

    @Test
    void shouldPassRequestedDelayToBulkCall() throws Exception {
        when(callManagementService.placeCalls(anyList(), any())).thenReturn(BulkCallResponse.of(List.of()));

        mockMvc.perform(post("/calls/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerIds\":[\"CUST001\"],\"delayMs\":1500}"))
                .andExpect(status().isOk());

        verify(callManagementService).placeCalls(List.of("CUST001"), Duration.ofMillis(1500));
    }

    @Test
    void shouldRejectBulkCallWithoutCustomers() throws Exception {
        mockMvc.perform(post("/calls/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerIds\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));

        verify(callManagementService, never()).placeCalls(anyList(), any());
    }

    @Test
    void shouldRejectNegativeBulkDelay() throws Exception {
        mockMvc.perform(post("/calls/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerIds\":[\"CUST001\"],\"delayMs\":-1}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRejectOversizedBulkCall() throws Exception {
        when(callManagementService.placeCalls(anyList(), any()))
                .thenThrow(new IllegalArgumentException("At most 50 customers per request"));

        mockMvc.perform(post("/calls/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerIds\":[\"CUST001\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("At most 50 customers per request"));
    }

    @Test
    void shouldListCustomersReadyForCalling() throws Exception {
        when(callManagementService.readyCustomers()).thenReturn(List.of(CustomerRecord.builder()
                .recordKey("CUST001").name("Alex Morgan").phone("+15551230001").status("retry")
                .lastCallDate(LocalDate.parse("2024-03-12")).build()));

        mockMvc.perform(get("/customers/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.customers[0].recordKey").value("CUST001"))
                .andExpect(jsonPath("$.customers[0].lastCallDate").value("2024-03-12"));
    }

    @Test
    void shouldMapRecordStoreOutageOnReadyListToServiceUnavailable() throws Exception {
        when(callManagementService.readyCustomers()).thenThrow(new TransientProviderException("google-sheets", "HTTP 503"));

        mockMvc.perform(get("/customers/ready"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void shouldListActiveCalls() throws Exception {
        CallSummary call = new CallSummary("CA1", "active", "CUST001", "Alex", "CONFIRM_INTEREST", 2,
                Map.of(), Instant.parse("2024-03-13T09:00:00Z"), Instant.parse("2024-03-13T09:00:20Z"), null);
        when(callManagementService.activeCalls())
                .thenReturn(new ActiveCallsResponse(1, 2.0, Map.of("CONFIRM_INTEREST", 1L), List.of(call)));

        mockMvc.perform(get("/calls/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeCount").value(1))
                .andExpect(jsonPath("$.byStep.CONFIRM_INTEREST").value(1))
                .andExpect(jsonPath("$.calls[0].callSid").value("CA1"))
                .andExpect(jsonPath("$.calls[0].outcome").doesNotExist());
    }

    @Test
    void shouldDescribeCall() throws Exception {
        when(callManagementService.callStatus("CA1")).thenReturn(Optional.of(CallSummary.finished("CA1")));

        mockMvc.perform(get("/calls/CA1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.callSid").value("CA1"))
                .andExpect(jsonPath("$.status").value("ended"));
    }

    @Test
    void shouldAnswerNotFoundForUnknownCall() throws Exception {
        when(callManagementService.callStatus("CA404")).thenReturn(Optional.empty());

        mockMvc.perform(get("/calls/CA404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("CallNotFound"));
    }

    @Test
    void shouldEndCallOnRequest() throws Exception {
        when(callManagementService.endCall("CA1")).thenReturn(new EndCallResponse("CA1", true, "no_response"));

        mockMvc.perform(post("/calls/CA1/end"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.providerHangup").value(true))
                .andExpect(jsonPath("$.outcome").value("no_response"));
    }

    @Test
    void shouldAnswerNotFoundWhenEndingUnknownCall() throws Exception {
        when(callManagementService.endCall("CA404")).thenThrow(new UnknownSessionException("CA404"));

        mockMvc.perform(post("/calls/CA404/end"))
                .andExpect(status().isNotFound());
    }
}
