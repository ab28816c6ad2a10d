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
import java.util.List;
import java.util.Map;

/**
 * Primary TTS: ElevenLabs text-to-speech, MP3 output.
 */
@Component
@Order(1)
public class ElevenLabsTtsProvider implements TtsProvider {

    static final String NAME = "elevenlabs";

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String voiceId;
    private final String modelId;
    private final String baseUrl;

    public ElevenLabsTtsProvider(RestTemplateBuilder builder,
                                 @Value("${elevenlabs.api-key:}") String apiKey,
                                 @Value("${elevenlabs.voice-id:21m00Tcm4TlvDq8ikWAM}") String voiceId,
                                 @Value("${elevenlabs.model-id:eleven_monolingual_v1}") String modelId,
                                 @Value("${elevenlabs.base-url:https://api.elevenlabs.io}") String baseUrl,
                                 @Value("${speech.provider-timeout:3s}") Duration timeout) {
        this.restTemplate = builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
        this.apiKey = apiKey;
        this.voiceId = voiceId;
        this.modelId = modelId;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
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
        String url = baseUrl + "/v1/text-to-speech/" + voiceId;

        HttpHeaders headers = new HttpHeaders();
        headers.set("xi-api-key", apiKey.trim());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.valueOf("audio/mpeg")));

        Map<String, Object> voiceSettings = new HashMap<>();
        voiceSettings.put("stability", 0.5);
        voiceSettings.put("similarity_boost", 0.75);

        Map<String, Object> body = new HashMap<>();
        body.put("text", text);
        body.put("model_id", modelId);
        body.put("voice_settings", voiceSettings);

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
