package com.ai.salescaller.service.speech;

import com.ai.salescaller.exception.PermanentProviderException;
import com.ai.salescaller.exception.ProviderErrors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

/**
 * Primary STT: Deepgram pre-recorded transcription of the raw recording bytes.
 */
@Component
@Order(1)
public class DeepgramSttProvider implements SttProvider {

    static final String NAME = "deepgram";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String url;

    public DeepgramSttProvider(RestTemplateBuilder builder,
                               ObjectMapper mapper,
                               @Value("${deepgram.api-key:}") String apiKey,
                               @Value("${deepgram.model:nova-2}") String model,
                               @Value("${deepgram.base-url:https://api.deepgram.com}") String baseUrl,
                               @Value("${speech.provider-timeout:3s}") Duration timeout) {
        this.restTemplate = builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
        this.mapper = mapper;
        this.apiKey = apiKey;
        this.url = StringUtils.removeEnd(baseUrl, "/") + "/v1/listen?model=" + model
                + "&language=en-US&smart_format=true&punctuate=true";
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
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Token " + apiKey.trim());
        headers.setContentType(MediaType.valueOf(StringUtils.defaultIfBlank(audio.getContentType(), "audio/wav")));

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(audio.getBytes(), headers), String.class);
            JsonNode alternative = mapper.readTree(response.getBody())
                    .path("results").path("channels").path(0).path("alternatives").path(0);
            if (alternative.isMissingNode()) {
                throw new PermanentProviderException(NAME, "No alternatives in response");
            }
            return new TranscriptionResult(
                    alternative.path("transcript").asText(""),
                    alternative.path("confidence").asDouble(0.0),
                    NAME);
        } catch (IOException ex) {
            throw new PermanentProviderException(NAME, "Unparseable response: " + ex.getMessage(), 0, ex);
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(NAME, ex);
        }
    }
}
