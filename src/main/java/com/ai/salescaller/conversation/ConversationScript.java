package com.ai.salescaller.conversation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Prompts and transition table of the outbound sales script.
 *
 * <p>Built once at startup and shared by reference; nothing here changes at runtime.
 * Placeholders: {@code {name}}, {@code {car}}, {@code {dealership}}, {@code {bot}},
 * {@code {time}}, {@code {email}}.
 */
public final class ConversationScript {

    private final String botName;
    private final Map<ScriptStep, String> questions;
    private final Map<ScriptStep, String> clarifications;
    private final Map<ScriptStep, Map<Intent, ScriptStep>> transitions;
    private final Map<CallOutcome, String> closings;
    private final String didNotCatch;
    private final String askAppointmentTime;
    private final String askEmailAgain;
    private final String similarWithoutEmail;
    private final String voicemail;

    private ConversationScript(Builder b) {
        this.botName = Objects.requireNonNull(b.botName, "botName");
        this.questions = freeze(b.questions);
        this.clarifications = freeze(b.clarifications);
        Map<ScriptStep, Map<Intent, ScriptStep>> t = new EnumMap<>(ScriptStep.class);
        b.transitions.forEach((step, row) -> t.put(step, freeze(row)));
        this.transitions = Collections.unmodifiableMap(t);
        this.closings = freeze(b.closings);
        this.didNotCatch = b.didNotCatch;
        this.askAppointmentTime = b.askAppointmentTime;
        this.askEmailAgain = b.askEmailAgain;
        this.similarWithoutEmail = b.similarWithoutEmail;
        this.voicemail = b.voicemail;
        validate();
    }

    /**
     * The dealership follow-up script: greeting, interest check, appointment, similar cars, email.
     */
    public static ConversationScript standard(String botName) {
        return builder(botName)
                .question(ScriptStep.GREETING,
                        "Hi {name}, this is {bot} from {dealership}. You recently enquired about the {car}. Is now a good time to talk?")
                .clarification(ScriptStep.GREETING,
                        "I just want to make sure - is this a good time for a quick chat about the {car}?")
                .question(ScriptStep.CONFIRM_INTEREST,
                        "I just wanted to check - are you still interested in the {car}?")
                .clarification(ScriptStep.CONFIRM_INTEREST,
                        "Just to confirm - are you still looking for the {car}, or has your situation changed?")
                .question(ScriptStep.ARRANGE_APPOINTMENT,
                        "Great! Would you like to arrange an appointment to see or test drive the {car}?")
                .clarification(ScriptStep.ARRANGE_APPOINTMENT,
                        "Would you like to schedule a time to come in and see the {car}?")
                .question(ScriptStep.OFFER_SIMILAR,
                        "No problem - sometimes the exact model isn't the right fit. Would you be interested in hearing about similar cars we currently have available?")
                .clarification(ScriptStep.OFFER_SIMILAR,
                        "Would you like me to send you information about similar vehicles that might interest you?")
                .question(ScriptStep.COLLECT_EMAIL,
                        "Perfect! What's the best email address to send those similar car options to?")
                .clarification(ScriptStep.COLLECT_EMAIL,
                        "Could you please spell out your email address so I can send you the options?")
                .transition(ScriptStep.GREETING, ScriptStep.CONFIRM_INTEREST, ScriptStep.ENDING, ScriptStep.CONFIRM_INTEREST)
                .transition(ScriptStep.CONFIRM_INTEREST, ScriptStep.ARRANGE_APPOINTMENT, ScriptStep.OFFER_SIMILAR, ScriptStep.OFFER_SIMILAR)
                .transition(ScriptStep.ARRANGE_APPOINTMENT, ScriptStep.ENDING, ScriptStep.OFFER_SIMILAR, ScriptStep.ENDING)
                .transition(ScriptStep.OFFER_SIMILAR, ScriptStep.COLLECT_EMAIL, ScriptStep.ENDING, ScriptStep.ENDING)
                .transition(ScriptStep.COLLECT_EMAIL, ScriptStep.ENDING, ScriptStep.ENDING, ScriptStep.ENDING)
                .closing(CallOutcome.APPOINTMENT_SCHEDULED,
                        "Perfect! I've booked you in for {time}. We'll send you a confirmation shortly. Thanks {name}!")
                .closing(CallOutcome.INTERESTED_SIMILAR,
                        "Thanks {name}! I'll send the details to {email} shortly. Have a great day!")
                .closing(CallOutcome.CALLBACK_REQUESTED,
                        "No problem at all! We'll give you a call back at a better time. Have a great day, {name}!")
                .closing(CallOutcome.NOT_INTERESTED,
                        "No problem at all, {name}. Thank you for your time, and feel free to contact us if anything changes. Have a great day!")
                .closing(CallOutcome.NO_RESPONSE,
                        "Thank you for your time. We'll follow up with you. Goodbye!")
                .closing(CallOutcome.CALL_FAILED,
                        "Thank you for your time. We'll follow up with you. Goodbye!")
                .closing(CallOutcome.SYSTEM_ERROR,
                        "I'm sorry, we're having some technical trouble on our end. Someone from {dealership} will follow up with you soon. Goodbye!")
                .didNotCatch("I'm sorry, I didn't catch that. ")
                .askAppointmentTime("What date and time works best for you?")
                .askEmailAgain("Could you please provide your email address so I can send you the similar car options?")
                .similarWithoutEmail("Thanks {name}! Someone from {dealership} will be in touch with some options. Have a great day!")
                .voicemail("Hi, this is {bot} from {dealership}. We're following up on your recent enquiry about the {car}. Please call us back at your convenience. Thank you!")
                .build();
    }

    public static Builder builder(String botName) {
        return new Builder(botName);
    }

    /** Next step for a classified answer; unknown combinations stay where they are. */
    public ScriptStep next(ScriptStep current, Intent intent) {
        Map<Intent, ScriptStep> row = transitions.get(current);
        if (row == null) {
            return current;
        }
        return row.getOrDefault(intent, current);
    }

    public String question(ScriptStep step, CustomerProfile customer) {
        return render(questions.get(step), customer, null);
    }

    public String reprompt(ScriptStep step, CustomerProfile customer) {
        return render(didNotCatch + clarifications.getOrDefault(step, questions.get(step)), customer, null);
    }

    public String askAppointmentTime(CustomerProfile customer) {
        return render(askAppointmentTime, customer, null);
    }

    public String askEmailAgain(CustomerProfile customer) {
        return render(askEmailAgain, customer, null);
    }

    public String closing(CallOutcome outcome, CustomerProfile customer, Map<String, String> data) {
        String template = closings.get(outcome);
        if (outcome == CallOutcome.INTERESTED_SIMILAR && data.get(ExtractedFields.EMAIL) == null) {
            template = similarWithoutEmail;
        }
        if (outcome == CallOutcome.APPOINTMENT_SCHEDULED && data.get(ExtractedFields.APPOINTMENT_TIME_SPOKEN) == null) {
            template = closings.get(CallOutcome.CALLBACK_REQUESTED);
        }
        return render(template, customer, data);
    }

    public String voicemail(CustomerProfile customer) {
        return render(voicemail, customer, null);
    }

    private String render(String template, CustomerProfile customer, Map<String, String> data) {
        if (template == null) {
            return "";
        }
        String out = template
                .replace("{name}", customer.getName())
                .replace("{car}", customer.getCarModel())
                .replace("{dealership}", customer.getDealershipName())
                .replace("{bot}", botName);
        if (data != null) {
            out = out.replace("{time}", data.getOrDefault(ExtractedFields.APPOINTMENT_TIME_SPOKEN, ""))
                    .replace("{email}", data.getOrDefault(ExtractedFields.EMAIL, ""));
        }
        return out;
    }

    private void validate() {
        for (ScriptStep step : ScriptStep.values()) {
            if (!step.expectsAnswer()) {
                continue;
            }
            if (!questions.containsKey(step)) {
                throw new IllegalStateException("No question for step " + step);
            }
            Map<Intent, ScriptStep> row = transitions.get(step);
            if (row == null || row.size() != Intent.values().length) {
                throw new IllegalStateException("Incomplete transition row for step " + step);
            }
            row.forEach((intent, target) -> {
                if (!step.isBefore(target)) {
                    throw new IllegalStateException("Transition " + step + " --" + intent + "--> " + target + " is not forward");
                }
            });
        }
        for (CallOutcome outcome : CallOutcome.values()) {
            if (!closings.containsKey(outcome)) {
                throw new IllegalStateException("No closing for outcome " + outcome);
            }
        }
    }

    private static <K extends Enum<K>, V> Map<K, V> freeze(Map<K, V> source) {
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }

    public static final class Builder {
        private final String botName;
        private final Map<ScriptStep, String> questions = new EnumMap<>(ScriptStep.class);
        private final Map<ScriptStep, String> clarifications = new EnumMap<>(ScriptStep.class);
        private final Map<ScriptStep, Map<Intent, ScriptStep>> transitions = new EnumMap<>(ScriptStep.class);
        private final Map<CallOutcome, String> closings = new EnumMap<>(CallOutcome.class);
        private String didNotCatch = "";
        private String askAppointmentTime;
        private String askEmailAgain;
        private String similarWithoutEmail;
        private String voicemail;

        private Builder(String botName) {
            this.botName = botName;
        }

        public Builder question(ScriptStep step, String text) {
            questions.put(step, text);
            return this;
        }

        public Builder clarification(ScriptStep step, String text) {
            clarifications.put(step, text);
            return this;
        }

        public Builder transition(ScriptStep from, ScriptStep onYes, ScriptStep onNo, ScriptStep onUnknown) {
            Map<Intent, ScriptStep> row = new EnumMap<>(Intent.class);
            row.put(Intent.YES, onYes);
            row.put(Intent.NO, onNo);
            row.put(Intent.UNKNOWN, onUnknown);
            transitions.put(from, row);
            return this;
        }

        public Builder closing(CallOutcome outcome, String text) {
            closings.put(outcome, text);
            return this;
        }

        public Builder didNotCatch(String text) {
            this.didNotCatch = text;
            return this;
        }

        public Builder askAppointmentTime(String text) {
            this.askAppointmentTime = text;
            return this;
        }

        public Builder askEmailAgain(String text) {
            this.askEmailAgain = text;
            return this;
        }

        public Builder similarWithoutEmail(String text) {
            this.similarWithoutEmail = text;
            return this;
        }

        public Builder voicemail(String text) {
            this.voicemail = text;
            return this;
        }

        public ConversationScript build() {
            return new ConversationScript(this);
        }
    }
}
