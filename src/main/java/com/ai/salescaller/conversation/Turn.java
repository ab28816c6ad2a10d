package com.ai.salescaller.conversation;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of the call transcript. Confidence is 1.0 for system prompts.
 */
public final class Turn {

    private final Speaker speaker;
    private final String text;
    private final Instant timestamp;
    private final double confidence;

    public Turn(Speaker speaker, String text, Instant timestamp, double confidence) {
        this.speaker = Objects.requireNonNull(speaker, "speaker");
        this.text = text != null ? text : "";
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.confidence = confidence;
    }

    public static Turn system(String text, Instant at) {
        return new Turn(Speaker.SYSTEM, text, at, 1.0);
    }

    public static Turn customer(String text, double confidence, Instant at) {
        return new Turn(Speaker.CUSTOMER, text, at, confidence);
    }

    public Speaker getSpeaker() {
        return speaker;
    }

    public String getText() {
        return text;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return speaker.name().toLowerCase() + ": " + text;
    }
}
