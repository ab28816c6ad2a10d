package com.ai.salescaller.service.speech;

import com.ai.salescaller.exception.PermanentProviderException;
import com.ai.salescaller.exception.ProviderErrors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

/**
 * Secondary STT: OpenAI Whisper.
 * Whisper reports no confidence; it is estimated from the segments' average log-probability.
 */
@Component
@Order(2)
public class WhisperSttProvider implements SttProvider {

    private static final Logger log = LoggerFactory.getLogger(WhisperSttProvider.class);

    static final String NAME = "whisper";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String url;

    public WhisperSttProvider(RestTemplateBuilder builder,
                              ObjectMapper mapper,
                              @Value("${openai.api-key:}") String apiKey,
                              @Value("${openai.base-url:https://api.openai.com}") String baseUrl,
                              @Value("${speech.provider-timeout:3s}") Duration timeout) {
        this.restTemplate = builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
        this.mapper = mapper;
        this.apiKey = apiKey;
        this.url = StringUtils.removeEnd(baseUrl, "/") + "/v1/audio/transcriptions";
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return StringUtils.isNotBlank(apiKey);
    }

    @Override
    public TranscriptionResult transcribe(RecordedAudio audio) {
        byte[] wav = audio.getBytes();
        log.debug("Whisper upload bytes={}", wav.length);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey.trim());
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("model", "whisper-1");
        form.add("language", "en");
        form.add("response_format", "verbose_json");
        form.add("file", new ByteArrayResource(wav) {
            @Override
            public String getFilename() {
                return "answer.wav";
            }
        });

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(form, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String text = root.path("text").asText("").trim();
            return new TranscriptionResult(text, estimateConfidence(root, text), NAME);
        } catch (IOException ex) {
            throw new PermanentProviderException(NAME, "Unparseable response: " + ex.getMessage(), 0, ex);
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(NAME, ex);
        }
    }

    static double estimateConfidence(JsonNode root, String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        JsonNode segments = root.path("segments");
        if (!segments.isArray() || segments.size() == 0) {
            return 1.0;
        }
        double sum = 0;
        for (JsonNode segment : segments) {
            double speech = 1.0 - segment.path("no_speech_prob").asDouble(0.0);
            sum += Math.exp(segment.path("avg_logprob").asDouble(0.0)) * speech;
        }
        return sum / segments.size();
    }
}
