package com.ai.salescaller.service.speech;

import com.ai.salescaller.exception.PermanentProviderException;
import com.ai.salescaller.exception.ProviderErrors;
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

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Secondary TTS: OpenAI audio speech endpoint.
 */
@Component
@Order(2)
public class OpenAiTtsProvider implements TtsProvider {

    static final String NAME = "openai-tts";

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String voice;
    private final String url;

    public OpenAiTtsProvider(RestTemplateBuilder builder,
                             @Value("${openai.api-key:}") String apiKey,
                             @Value("${openai.tts-voice:nova}") String voice,
                             @Value("${openai.base-url:https://api.openai.com}") String baseUrl,
                             @Value("${speech.provider-timeout:3s}") Duration timeout) {
        this.restTemplate = builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
        this.apiKey = apiKey;
        this.voice = voice;
        this.url = StringUtils.removeEnd(baseUrl, "/") + "/v1/audio/speech";
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
    public SynthesizedAudio synthesize(String text) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey.trim());
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", "tts-1");
        body.put("voice", voice);
        body.put("input", text);
        body.put("response_format", "mp3");

        try {
            ResponseEntity<byte[]> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), byte[].class);
            byte[] audio = response.getBody();
            if (audio == null || audio.length == 0) {
                throw new PermanentProviderException(NAME, "Empty audio body");
            }
            return new SynthesizedAudio(audio, "audio/mpeg");
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(NAME, ex);
        }
    }
}
