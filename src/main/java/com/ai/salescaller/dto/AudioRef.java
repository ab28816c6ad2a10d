package com.ai.salescaller.dto;

import java.util.Objects;

/**
 * Something the telephony provider can play: a URL of synthesized (or pre-recorded) audio, or text
 * for the provider's own built-in voice when no synthesized audio is available.
 */
public final class AudioRef {

    public enum Kind { URL, SPOKEN_TEXT }

    private final Kind kind;
    private final String value;
    private final boolean degraded;

    private AudioRef(Kind kind, String value, boolean degraded) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.degraded = degraded;
    }

    public static AudioRef url(String url) {
        return new AudioRef(Kind.URL, url, false);
    }

    public static AudioRef degradedUrl(String url) {
        return new AudioRef(Kind.URL, url, true);
    }

    public static AudioRef degradedSpokenText(String text) {
        return new AudioRef(Kind.SPOKEN_TEXT, text, true);
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    /** True when neither speech provider produced this audio. */
    public boolean isDegraded() {
        return degraded;
    }

    @Override
    public String toString() {
        return kind + (degraded ? "(degraded)" : "") + ":" + value;
    }
}
