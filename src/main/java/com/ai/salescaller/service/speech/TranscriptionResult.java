package com.ai.salescaller.service.speech;

/**
 * Transcript plus recognizer confidence. A degraded result (all providers failed) has an empty
 * transcript and confidence 0.
 */
public final class TranscriptionResult {

    private final String transcript;
    private final double confidence;
    private final String provider;
    private final boolean providerFailure;

    public TranscriptionResult(String transcript, double confidence, String provider) {
        this(transcript, confidence, provider, false);
    }

    private TranscriptionResult(String transcript, double confidence, String provider, boolean providerFailure) {
        this.transcript = transcript != null ? transcript.trim() : "";
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.provider = provider;
        this.providerFailure = providerFailure;
    }

    public static TranscriptionResult degraded() {
        return new TranscriptionResult("", 0.0, "none", true);
    }

    public String getTranscript() {
        return transcript;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getProvider() {
        return provider;
    }

    public boolean isProviderFailure() {
        return providerFailure;
    }
}
