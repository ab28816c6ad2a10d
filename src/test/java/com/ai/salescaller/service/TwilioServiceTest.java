package com.ai.salescaller.service;

import com.ai.salescaller.exception.PermanentProviderException;
import com.ai.salescaller.exception.TransientProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TwilioServiceTest {

    private static final String CALLS_URL = "https://api.twilio.test/Accounts/AC1/Calls.json";

    private MockServerRestTemplateCustomizer customizer;
    private MockRestServiceServer server;
    private TwilioService twilio;

    @BeforeEach
    void setUp() {
        customizer = new MockServerRestTemplateCustomizer();
        twilio = service("AC1", "https://caller.test");
        server = customizer.getServer();
    }

    @Test
    void shouldPlaceCallWithWebhooksAndMachineDetection() {
        server.expect(requestTo(CALLS_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Basic QUMxOnNlY3JldA=="))
                .andExpect(content().formDataContains(Map.of(
                        "To", "+15551230001",
                        "From", "+15550000000",
                        "Url", "https://caller.test/voice",
                        "StatusCallback", "https://caller.test/status",
                        "MachineDetection", "Enable")))
                .andRespond(withSuccess("{\"sid\":\"CA123\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        assertThat(twilio.placeCall("+15551230001")).isEqualTo("CA123");
        server.verify();
    }

    @Test
    void shouldRefuseToDialWithoutPublicBaseUrl() {
        TwilioService unconfigured = service("AC1", "");

        assertThat(unconfigured.isConfigured()).isFalse();
        assertThatThrownBy(() -> unconfigured.placeCall("+15551230001"))
                .isInstanceOf(PermanentProviderException.class)
                .hasMessageContaining("twilio.base-url");
    }

    @Test
    void shouldClassifyRejectedNumberAsPermanent() {
        server.expect(requestTo(CALLS_URL))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("{\"code\":21211}").contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> twilio.placeCall("+1000"))
                .isInstanceOf(PermanentProviderException.class);
    }

    @Test
    void shouldClassifyTwilioOutageAsTransient() {
        server.expect(requestTo(CALLS_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> twilio.placeCall("+15551230001"))
                .isInstanceOf(TransientProviderException.class);
    }

    @Test
    void shouldHangUpByCompletingTheCall() {
        server.expect(requestTo("https://api.twilio.test/Accounts/AC1/Calls/CA123.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of("Status", "completed")))
                .andRespond(withSuccess("{\"sid\":\"CA123\",\"status\":\"completed\"}", MediaType.APPLICATION_JSON));

        twilio.hangUp("CA123");
        server.verify();
    }

    @Test
    void shouldReportHangupOfUnknownCallAsPermanent() {
        server.expect(requestTo("https://api.twilio.test/Accounts/AC1/Calls/CA404.json"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> twilio.hangUp("CA404"))
                .isInstanceOf(PermanentProviderException.class);
    }

    @Test
    void shouldDownloadRecordingAsWav() {
        byte[] wav = {82, 73, 70, 70};
        server.expect(requestTo("https://api.twilio.test/Recordings/RE1.wav"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(wav, MediaType.parseMediaType("audio/wav")));

        assertThat(twilio.fetchRecording("https://api.twilio.test/Recordings/RE1")).containsExactly(wav);
    }

    private TwilioService service(String accountSid, String baseUrl) {
        return new TwilioService(new RestTemplateBuilder(customizer), new ObjectMapper(),
                accountSid, "secret", "+15550000000", baseUrl, "https://api.twilio.test", Duration.ofSeconds(5));
    }
}
