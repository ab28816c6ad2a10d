package com.ai.salescaller.service.speech;

import com.ai.salescaller.config.SpeechProperties;
import com.ai.salescaller.dto.AudioRef;
import com.ai.salescaller.exception.ProviderErrors;
import com.ai.salescaller.exception.ProviderException;
import com.ai.salescaller.exception.TransientProviderException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One entry point for speech in both directions. Providers are tried in order, one at a time,
 * each attempt bounded by {@code speech.provider-timeout}. Neither method throws: when every
 * provider fails the caller gets a degraded result it can still use.
 */
@Service
public class SpeechServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(SpeechServiceAdapter.class);

    private final List<TtsProvider> ttsProviders;
    private final List<SttProvider> sttProviders;
    private final Map<String, ProviderCircuitBreaker> breakers = new LinkedHashMap<>();
    private final AudioCache audioCache;
    private final SpeechProperties properties;
    private final AsyncTaskExecutor speechExecutor;
    private final String baseUrl;

    public SpeechServiceAdapter(List<TtsProvider> ttsProviders,
                                List<SttProvider> sttProviders,
                                AudioCache audioCache,
                                SpeechProperties properties,
                                @Qualifier("speechExecutor") AsyncTaskExecutor speechExecutor,
                                Clock clock,
                                @Value("${twilio.base-url:}") String baseUrl) {
        this.ttsProviders = new ArrayList<>(ttsProviders);
        this.sttProviders = new ArrayList<>(sttProviders);
        this.audioCache = audioCache;
        this.properties = properties;
        this.speechExecutor = speechExecutor;
        this.baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(baseUrl), "/");
        SpeechProperties.Breaker b = properties.getBreaker();
        for (TtsProvider p : ttsProviders) {
            breakers.put(p.getName(), new ProviderCircuitBreaker(p.getName(), b.getFailureThreshold(), b.getWindow(), b.getCoolDown(), clock));
        }
        for (SttProvider p : sttProviders) {
            breakers.put(p.getName(), new ProviderCircuitBreaker(p.getName(), b.getFailureThreshold(), b.getWindow(), b.getCoolDown(), clock));
        }
        log.info("Speech adapter ready: tts={} stt={}", names(ttsProviders), namesStt(sttProviders));
    }

    public SynthesisResult synthesize(String text) {
        boolean attempted = false;
        for (TtsProvider provider : ttsProviders) {
            if (!provider.isEnabled()) {
                continue;
            }
            ProviderCircuitBreaker breaker = breakers.get(provider.getName());
            if (!breaker.tryAcquire()) {
                log.debug("Skipping {}: circuit open", provider.getName());
                continue;
            }
            attempted = true;
            try {
                SynthesizedAudio audio = callWithTimeout(provider.getName(), () -> provider.synthesize(text));
                breaker.recordSuccess();
                String id = audioCache.put(audio);
                return new SynthesisResult(AudioRef.url(baseUrl + "/audio/" + id), false);
            } catch (ProviderException e) {
                breaker.recordFailure();
                log.warn("TTS provider {} failed (retryable={}): {}", provider.getName(), e.isRetryable(), e.getMessage());
            }
        }
        if (attempted) {
            log.warn("All TTS providers failed, using degraded prompt");
        }
        return new SynthesisResult(degradedAudio(text), attempted);
    }

    public TranscriptionResult transcribe(RecordedAudio audio) {
        for (SttProvider provider : sttProviders) {
            if (!provider.isEnabled()) {
                continue;
            }
            ProviderCircuitBreaker breaker = breakers.get(provider.getName());
            if (!breaker.tryAcquire()) {
                log.debug("Skipping {}: circuit open", provider.getName());
                continue;
            }
            try {
                TranscriptionResult result = callWithTimeout(provider.getName(), () -> provider.transcribe(audio));
                breaker.recordSuccess();
                return result;
            } catch (ProviderException e) {
                breaker.recordFailure();
                log.warn("STT provider {} failed (retryable={}): {}", provider.getName(), e.isRetryable(), e.getMessage());
            }
        }
        log.warn("No STT provider produced a transcript, returning degraded result");
        return TranscriptionResult.degraded();
    }

    ProviderCircuitBreaker breakerFor(String provider) {
        return breakers.get(provider);
    }

    private AudioRef degradedAudio(String text) {
        if (StringUtils.isNotBlank(properties.getDegradedPromptUrl())) {
            return AudioRef.degradedUrl(properties.getDegradedPromptUrl().trim());
        }
        return AudioRef.degradedSpokenText(text);
    }

    private <T> T callWithTimeout(String provider, Callable<T> call) {
        long timeoutMs = properties.getProviderTimeout().toMillis();
        Future<T> future;
        try {
            future = speechExecutor.submit(call);
        } catch (TaskRejectedException e) {
            throw new TransientProviderException(provider, "Speech executor saturated", e);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientProviderException(provider, "Timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientProviderException(provider, "Interrupted", e);
        } catch (ExecutionException e) {
            throw ProviderErrors.translate(provider, e.getCause());
        }
    }

    private static List<String> names(List<TtsProvider> providers) {
        List<String> out = new ArrayList<>();
        providers.forEach(p -> out.add(p.getName() + (p.isEnabled() ? "" : "(disabled)")));
        return out;
    }

    private static List<String> namesStt(List<SttProvider> providers) {
        List<String> out = new ArrayList<>();
        providers.forEach(p -> out.add(p.getName() + (p.isEnabled() ? "" : "(disabled)")));
        return out;
    }
}
