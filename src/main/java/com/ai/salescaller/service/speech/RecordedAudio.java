package com.ai.salescaller.service.speech;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A customer recording held by the telephony provider. The bytes are downloaded on first use
 * and reused by the fallback provider.
 */
public final class RecordedAudio {

    private final String url;
    private final String contentType;
    private final Supplier<byte[]> loader;
    private byte[] bytes;

    public RecordedAudio(String url, String contentType, Supplier<byte[]> loader) {
        this.url = Objects.requireNonNull(url, "url");
        this.contentType = contentType;
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public static RecordedAudio ofBytes(byte[] bytes, String contentType) {
        return new RecordedAudio("memory:", contentType, () -> bytes);
    }

    public String getUrl() {
        return url;
    }

    public String getContentType() {
        return contentType;
    }

    public synchronized byte[] getBytes() {
        if (bytes == null) {
            bytes = loader.get();
        }
        return bytes;
    }
}
