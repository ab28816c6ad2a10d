package com.ai.salescaller.dto;

/**
 * Semantic content of a webhook response: what to play, whether to listen for more speech,
 * whether to hang up. Rendered into provider markup by the controller layer.
 */
public final class VoiceDirective {

    private final AudioRef promptAudioRef;
    private final boolean expectMoreInput;
    private final boolean hangup;

    private VoiceDirective(AudioRef promptAudioRef, boolean expectMoreInput, boolean hangup) {
        this.promptAudioRef = promptAudioRef;
        this.expectMoreInput = expectMoreInput;
        this.hangup = hangup;
    }

    public static VoiceDirective gather(AudioRef prompt) {
        return new VoiceDirective(prompt, true, false);
    }

    public static VoiceDirective sayAndHangup(AudioRef prompt) {
        return new VoiceDirective(prompt, false, true);
    }

    public static VoiceDirective hangupOnly() {
        return new VoiceDirective(null, false, true);
    }

    /** Nothing to add: the provider keeps doing what it was doing. */
    public static VoiceDirective empty() {
        return new VoiceDirective(null, false, false);
    }

    public AudioRef getPromptAudioRef() {
        return promptAudioRef;
    }

    public boolean isExpectMoreInput() {
        return expectMoreInput;
    }

    public boolean isHangup() {
        return hangup;
    }
}
