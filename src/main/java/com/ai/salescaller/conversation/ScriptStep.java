package com.ai.salescaller.conversation;

/**
 * Stages of the outbound sales script, declared in script order.
 * A session only ever moves to a later constant or to {@link #TERMINATED}.
 */
public enum ScriptStep {
    GREETING,
    CONFIRM_INTEREST,
    ARRANGE_APPOINTMENT,
    OFFER_SIMILAR,
    COLLECT_EMAIL,
    ENDING,
    TERMINATED;

    public boolean isBefore(ScriptStep other) {
        return ordinal() < other.ordinal();
    }

    /** Steps that put a question to the customer and wait for an answer. */
    public boolean expectsAnswer() {
        return this != ENDING && this != TERMINATED;
    }
}
