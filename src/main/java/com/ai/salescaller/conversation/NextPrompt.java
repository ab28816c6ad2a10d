package com.ai.salescaller.conversation;

/**
 * Structured result of one conversation turn: what to say next and whether the call ends after it.
 */
public final class NextPrompt {

    public enum Type {
        /** Normal question for the current (possibly new) step. */
        QUESTION,
        /** Same step asked again after a low-confidence or incomplete answer. */
        REPROMPT,
        /** Closing message; the call hangs up after it. */
        END_CALL,
        /** The call ended while this turn was in flight; nothing is spoken. */
        DISCARDED,
        /** Duplicate or late webhook for a call whose turn is already settled. */
        IGNORED
    }

    private final Type type;
    private final String text;
    private final ScriptStep step;

    private NextPrompt(Type type, String text, ScriptStep step) {
        this.type = type;
        this.text = text != null ? text : "";
        this.step = step;
    }

    public static NextPrompt question(String text, ScriptStep step) {
        return new NextPrompt(Type.QUESTION, text, step);
    }

    public static NextPrompt reprompt(String text, ScriptStep step) {
        return new NextPrompt(Type.REPROMPT, text, step);
    }

    public static NextPrompt endCall(String text) {
        return new NextPrompt(Type.END_CALL, text, ScriptStep.TERMINATED);
    }

    public static NextPrompt discarded() {
        return new NextPrompt(Type.DISCARDED, "", ScriptStep.TERMINATED);
    }

    public static NextPrompt ignored(ScriptStep step) {
        return new NextPrompt(Type.IGNORED, "", step);
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public ScriptStep getStep() {
        return step;
    }

    public boolean isEndCall() {
        return type == Type.END_CALL || type == Type.DISCARDED;
    }

    /** True when there is something to synthesize and play. */
    public boolean isSpoken() {
        return !text.isEmpty() && type != Type.DISCARDED && type != Type.IGNORED;
    }

    @Override
    public String toString() {
        return type + "[" + step + "] " + text;
    }
}
