package com.ai.salescaller.service.speech;

import java.util.Objects;

/**
 * Audio bytes returned by a TTS provider.
 */
public final class SynthesizedAudio {

    private final byte[] bytes;
    private final String contentType;

    public SynthesizedAudio(byte[] bytes, String contentType) {
        this.bytes = Objects.requireNonNull(bytes, "bytes");
        this.contentType = Objects.requireNonNull(contentType, "contentType");
    }

    public byte[] getBytes() {
        return bytes;
    }

    public String getContentType() {
        return contentType;
    }
}
