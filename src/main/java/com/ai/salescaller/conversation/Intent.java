package com.ai.salescaller.conversation;

import java.util.Locale;
import java.util.Optional;

/**
 * Classified customer answer for the current step.
 * Every spoken variation (yes, yeah, sure, no, nope, not now) collapses into one of these.
 */
public enum Intent {
    YES,
    NO,
    UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Intent> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Intent intent : values()) {
            if (intent.label().equals(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
