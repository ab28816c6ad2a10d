package com.ai.salescaller.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Speech adapter timeouts, circuit breaker and degraded-mode settings ({@code speech.*}).
 */
@Component
@ConfigurationProperties(prefix = "speech")
public class SpeechProperties {

    /** Per provider attempt; distinct from the webhook's own response deadline. */
    private Duration providerTimeout = Duration.ofSeconds(3);

    /** Pre-recorded generic prompt played when both TTS providers fail. Blank: provider's built-in voice. */
    private String degradedPromptUrl = "";

    private Duration audioCacheTtl = Duration.ofMinutes(15);

    private int executorThreads = 16;

    private Breaker breaker = new Breaker();

    public Duration getProviderTimeout() {
        return providerTimeout;
    }

    public void setProviderTimeout(Duration providerTimeout) {
        this.providerTimeout = providerTimeout;
    }

    public String getDegradedPromptUrl() {
        return degradedPromptUrl;
    }

    public void setDegradedPromptUrl(String degradedPromptUrl) {
        this.degradedPromptUrl = degradedPromptUrl;
    }

    public Duration getAudioCacheTtl() {
        return audioCacheTtl;
    }

    public void setAudioCacheTtl(Duration audioCacheTtl) {
        this.audioCacheTtl = audioCacheTtl;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public void setBreaker(Breaker breaker) {
        this.breaker = breaker;
    }

    public static class Breaker {
        private int failureThreshold = 3;
        private Duration window = Duration.ofSeconds(30);
        private Duration coolDown = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public Duration getCoolDown() {
            return coolDown;
        }

        public void setCoolDown(Duration coolDown) {
            this.coolDown = coolDown;
        }
    }
}
