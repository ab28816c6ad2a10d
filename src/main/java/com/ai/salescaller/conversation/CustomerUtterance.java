package com.ai.salescaller.conversation;

/**
 * The customer's side of a turn as delivered by the speech layer.
 * {@code providerFailure} marks a degraded transcription rather than a real answer.
 */
public final class CustomerUtterance {

    private final String transcript;
    private final double confidence;
    private final boolean providerFailure;

    public CustomerUtterance(String transcript, double confidence, boolean providerFailure) {
        this.transcript = transcript != null ? transcript.trim() : "";
        this.confidence = confidence;
        this.providerFailure = providerFailure;
    }

    public static CustomerUtterance of(String transcript, double confidence) {
        return new CustomerUtterance(transcript, confidence, false);
    }

    public static CustomerUtterance failed() {
        return new CustomerUtterance("", 0.0, true);
    }

    public String getTranscript() {
        return transcript;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isProviderFailure() {
        return providerFailure;
    }

    public boolean isEmpty() {
        return transcript.isEmpty();
    }
}
