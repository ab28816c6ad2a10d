package com.ai.salescaller.service.speech;

/**
 * Speech-to-text backend for recorded customer answers.
 */
public interface SttProvider {

    String getName();

    boolean isEnabled();

    /**
     * @throws com.ai.salescaller.exception.ProviderException on any provider failure
     */
    TranscriptionResult transcribe(RecordedAudio audio);
}
