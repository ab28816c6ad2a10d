package com.ai.salescaller.service.extraction;

import com.ai.salescaller.conversation.ScriptStep;
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
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifies an unclear answer with OpenAI Chat Completions, constrained to a fixed label set.
 */
@Service
public class OpenAiIntentClassifier implements LlmIntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(OpenAiIntentClassifier.class);

    static final String PROVIDER = "openai-chat";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String model;
    private final String url;

    public OpenAiIntentClassifier(RestTemplateBuilder builder,
                                  ObjectMapper mapper,
                                  @Value("${openai.api-key:}") String apiKey,
                                  @Value("${openai.model:gpt-4o-mini}") String model,
                                  @Value("${openai.base-url:https://api.openai.com}") String baseUrl,
                                  @Value("${openai.timeout:3s}") Duration timeout) {
        this.restTemplate = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
        this.mapper = mapper;
        this.apiKey = apiKey;
        this.model = model;
        this.url = StringUtils.removeEnd(baseUrl, "/") + "/v1/chat/completions";
    }

    @Override
    public boolean isEnabled() {
        return StringUtils.isNotBlank(apiKey);
    }

    @Override
    public String classify(ScriptStep step, String question, String transcript, Set<String> allowedLabels) {
        String labels = String.join(", ", new TreeSet<>(allowedLabels));

        StringBuilder system = new StringBuilder();
        system.append("You classify a customer's spoken answer during a car dealership follow-up call.\n");
        system.append("The customer was asked: \"").append(question).append("\"\n");
        system.append("Reply with exactly one word from this list and nothing else: ").append(labels).append(".\n");
        system.append("- yes: the customer agrees or answers positively.\n");
        system.append("- no: the customer declines or answers negatively.\n");
        system.append("- unknown: the answer is unclear, off-topic, or mixed.\n");

        List<Map<String, String>> messages = new ArrayList<>();
        Map<String, String> systemMsg = new HashMap<>();
        systemMsg.put("role", "system");
        systemMsg.put("content", system.toString());
        messages.add(systemMsg);
        Map<String, String> userMsg = new HashMap<>();
        userMsg.put("role", "user");
        userMsg.put("content", transcript);
        messages.add(userMsg);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", 0);
        body.put("max_tokens", 3);
        body.put("messages", messages);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey.trim());
        headers.setContentType(MediaType.APPLICATION_JSON);

        String content;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            content = root.path("choices").path(0).path("message").path("content").asText("").trim();
        } catch (IOException ex) {
            throw new PermanentProviderException(PROVIDER, "Unparseable completion: " + ex.getMessage(), 0, ex);
        } catch (RuntimeException ex) {
            throw ProviderErrors.translate(PROVIDER, ex);
        }
        log.debug("LLM label for step {}: '{}'", step, content);
        return content;
    }
}
