package com.ai.salescaller.service.speech;

/**
 * Text-to-speech backend.
 */
public interface TtsProvider {

    String getName();

    /** False when credentials are missing; the adapter skips the provider without counting a failure. */
    boolean isEnabled();

    /**
     * @throws com.ai.salescaller.exception.ProviderException on any provider failure
     */
    SynthesizedAudio synthesize(String text);
}
