package com.ai.salescaller.conversation;

/**
 * Keys of {@link CallSession#getExtractedData()} and their spoken-answer values.
 */
public final class ExtractedFields {

    public static final String GOOD_TIME_TO_TALK = "goodTimeToTalk";
    public static final String STILL_INTERESTED = "stillInterested";
    public static final String WANTS_APPOINTMENT = "wantsAppointment";
    public static final String APPOINTMENT_TIME = "appointmentTime";
    public static final String APPOINTMENT_TIME_SPOKEN = "appointmentTimeSpoken";
    public static final String WANTS_SIMILAR = "wantsSimilar";
    public static final String EMAIL = "email";

    public static final String YES = "yes";
    public static final String NO = "no";
    public static final String UNKNOWN = "unknown";

    private ExtractedFields() {
    }

    /** Yes/no field answered at each step, or null for steps that collect free data. */
    public static String yesNoFieldFor(ScriptStep step) {
        switch (step) {
            case GREETING:
                return GOOD_TIME_TO_TALK;
            case CONFIRM_INTEREST:
                return STILL_INTERESTED;
            case ARRANGE_APPOINTMENT:
                return WANTS_APPOINTMENT;
            case OFFER_SIMILAR:
                return WANTS_SIMILAR;
            default:
                return null;
        }
    }
}
