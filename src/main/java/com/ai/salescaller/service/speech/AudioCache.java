package com.ai.salescaller.service.speech;

import com.ai.salescaller.config.SpeechProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds synthesized prompts until the telephony provider fetches them from {@code /audio/{id}}.
 */
@Component
public class AudioCache {

    private static final Logger log = LoggerFactory.getLogger(AudioCache.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final SpeechProperties properties;
    private final Clock clock;

    public AudioCache(SpeechProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public static final class Entry {
        private final SynthesizedAudio audio;
        private final Instant storedAt;

        Entry(SynthesizedAudio audio, Instant storedAt) {
            this.audio = audio;
            this.storedAt = storedAt;
        }

        public SynthesizedAudio getAudio() {
            return audio;
        }

        public Instant getStoredAt() {
            return storedAt;
        }
    }

    public String put(SynthesizedAudio audio) {
        String id = UUID.randomUUID().toString();
        entries.put(id, new Entry(audio, clock.instant()));
        return id;
    }

    public Optional<SynthesizedAudio> get(String id) {
        Entry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.getAudio());
    }

    @Scheduled(fixedDelayString = "${speech.audio-cache-sweep-ms:60000}")
    public void evictExpired() {
        Instant horizon = clock.instant().minus(properties.getAudioCacheTtl());
        int before = entries.size();
        entries.values().removeIf(e -> e.getStoredAt().isBefore(horizon));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Evicted {} cached prompt(s)", removed);
        }
    }

    public int size() {
        return entries.size();
    }
}
