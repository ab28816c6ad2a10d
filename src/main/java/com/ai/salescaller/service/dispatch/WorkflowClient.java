package com.ai.salescaller.service.dispatch;

import com.ai.salescaller.config.DispatchProperties;
import com.ai.salescaller.exception.ProviderErrors;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts call events to the external workflow engine. The call id travels as
 * {@code Idempotency-Key} so a re-delivered event can be recognized downstream.
 */
@Component
public class WorkflowClient {

    private static final Logger log = LoggerFactory.getLogger(WorkflowClient.class);

    static final String PROVIDER = "workflow";
    static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private final RestTemplate restTemplate;
    private final DispatchProperties properties;

    public WorkflowClient(RestTemplateBuilder builder, DispatchProperties properties) {
        this.restTemplate = builder
                .setConnectTimeout(properties.getWorkflowTimeout())
                .setReadTimeout(properties.getWorkflowTimeout())
                .build();
        this.properties = properties;
    }

    public boolean isEnabled() {
        return StringUtils.isNotBlank(properties.getWorkflowUrl());
    }

    /**
     * @throws com.ai.salescaller.exception.ProviderException when the endpoint rejects the event or cannot be reached
     */
    public void post(CallOutcomeReport report) {
        if (!isEnabled()) {
            log.debug("[{}] dispatch.workflow-url not set; skipping workflow event", report.getCallId());
            return;
        }
        Map<String, Object> payload = report.toWorkflowPayload();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(IDEMPOTENCY_KEY, report.getCallId());

        try {
            restTemplate.postForEntity(properties.getWorkflowUrl().trim(), new HttpEntity<>(payload, headers), String.class);
            log.info("[{}] Workflow notified: event={} outcome={}", report.getCallId(), payload.get("event"), report.getOutcome().wireName());
        } catch (RestClientException e) {
            throw ProviderErrors.translate(PROVIDER, e);
        }
    }
}
