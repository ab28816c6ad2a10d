package com.ai.salescaller.service.speech;

import com.ai.salescaller.dto.AudioRef;

/**
 * Outcome of a synthesis request. Always carries something playable.
 * {@code providerFailure} is set when at least one provider was tried and none succeeded.
 */
public final class SynthesisResult {

    private final AudioRef audio;
    private final boolean providerFailure;

    public SynthesisResult(AudioRef audio, boolean providerFailure) {
        this.audio = audio;
        this.providerFailure = providerFailure;
    }

    public AudioRef getAudio() {
        return audio;
    }

    public boolean isProviderFailure() {
        return providerFailure;
    }
}
