package com.ai.salescaller.service;

import com.ai.salescaller.exception.PermanentProviderException;
import com.ai.salescaller.exception.ProviderErrors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

/**
 * Twilio REST API: placing and hanging up outbound calls, and downloading answer recordings.
 */
@Service
public class TwilioService {

    private static final Logger log = LoggerFactory.getLogger(TwilioService.class);

    static final String PROVIDER = "twilio";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String accountSid;
    private final String authToken;
    private final String fromNumber;
    private final String baseUrl;
    private final String apiBase;

    public TwilioService(RestTemplateBuilder builder,
                         ObjectMapper mapper,
                         @Value("${twilio.account-sid:}") String accountSid,
                         @Value("${twilio.auth-token:}") String authToken,
                         @Value("${twilio.from-number:}") String fromNumber,
                         @Value("${twilio.base-url:}") String baseUrl,
                         @Value("${twilio.api-base:https://api.twilio.com/2010-04-01}") String apiBase,
                         @Value("${twilio.timeout:10s}") Duration timeout) {
        this.restTemplate = builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
        this.mapper = mapper;
        this.accountSid = accountSid;
        this.authToken = authToken;
        this.fromNumber = fromNumber;
        this.baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(baseUrl), "/");
        this.apiBase = StringUtils.removeEnd(apiBase, "/");
    }

    public boolean isConfigured() {
        return StringUtils.isNoneBlank(accountSid, authToken, fromNumber, baseUrl);
    }

    /**
     * Starts an outbound call. Twilio fetches {@code /voice} when the customer answers and reports
     * progress to {@code /status}.
     *
     * @return the new call's sid
     */
    public String placeCall(String to) {
        if (!isConfigured()) {
            throw new PermanentProviderException(PROVIDER,
                    "twilio.account-sid, twilio.auth-token, twilio.from-number and twilio.base-url must be set");
        }
        String apiUrl = apiBase + "/Accounts/" + accountSid + "/Calls.json";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(accountSid, authToken);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("To", to);
        body.add("From", fromNumber);
        body.add("Url", baseUrl + "/voice");
        body.add("Method", "POST");
        body.add("StatusCallback", baseUrl + "/status");
        body.add("StatusCallbackMethod", "POST");
        body.add("StatusCallbackEvent", "completed");
        body.add("MachineDetection", "Enable");
        body.add("Timeout", "30");

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(apiUrl, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String sid = root.path("sid").asText("");
            if (sid.isEmpty()) {
                throw new PermanentProviderException(PROVIDER, "No call sid in response");
            }
            log.info("[{}] Outbound call placed", sid);
            return sid;
        } catch (IOException e) {
            throw new PermanentProviderException(PROVIDER, "Unparseable response: " + e.getMessage(), 0, e);
        } catch (RestClientException e) {
            throw ProviderErrors.translate(PROVIDER, e);
        }
    }

    /** Hangs up a call in progress by moving it to {@code completed}. */
    public void hangUp(String callSid) {
        if (!isConfigured()) {
            throw new PermanentProviderException(PROVIDER, "Twilio is not configured");
        }
        String apiUrl = apiBase + "/Accounts/" + accountSid + "/Calls/" + callSid + ".json";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(accountSid, authToken);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("Status", "completed");
        try {
            restTemplate.postForEntity(apiUrl, new HttpEntity<>(body, headers), String.class);
            log.info("[{}] Hangup requested", callSid);
        } catch (RestClientException e) {
            throw ProviderErrors.translate(PROVIDER, e);
        }
    }

    /** Downloads a recording as WAV. */
    public byte[] fetchRecording(String recordingUrl) {
        String url = recordingUrl.endsWith(".wav") ? recordingUrl : recordingUrl + ".wav";
        HttpHeaders headers = new HttpHeaders();
        if (StringUtils.isNoneBlank(accountSid, authToken)) {
            headers.setBasicAuth(accountSid, authToken);
        }
        try {
            ResponseEntity<byte[]> response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
            byte[] audio = response.getBody();
            if (audio == null || audio.length == 0) {
                throw new PermanentProviderException(PROVIDER, "Empty recording");
            }
            return audio;
        } catch (RestClientException e) {
            throw ProviderErrors.translate(PROVIDER, e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
