package com.ai.salescaller.service;

import com.ai.salescaller.config.CallerProperties;
import com.ai.salescaller.conversation.CallOutcome;
import com.ai.salescaller.conversation.CallSession;
import com.ai.salescaller.conversation.ConversationScript;
import com.ai.salescaller.conversation.CustomerProfile;
import com.ai.salescaller.conversation.CustomerRef;
import com.ai.salescaller.conversation.CustomerUtterance;
import com.ai.salescaller.conversation.ExtractedFields;
import com.ai.salescaller.conversation.NextPrompt;
import com.ai.salescaller.conversation.ScriptStep;
import com.ai.salescaller.conversation.Speaker;
import com.ai.salescaller.conversation.Turn;
import com.ai.salescaller.exception.TransientProviderException;
import com.ai.salescaller.service.dispatch.NotificationDispatcher;
import com.ai.salescaller.service.extraction.AppointmentTimeParser;
import com.ai.salescaller.service.extraction.EmailExtractor;
import com.ai.salescaller.service.extraction.IntentExtractor;
import com.ai.salescaller.service.extraction.LlmIntentClassifier;
import com.ai.salescaller.service.extraction.YesNoClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ConversationStateMachineTest {

    private static final String CALL = "CA100";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-13T09:00:00Z"), ZoneOffset.UTC);

    private SessionStore store;
    private NotificationDispatcher dispatcher;
    private ScriptedLlm llm;
    private ConversationStateMachine machine;

    @BeforeEach
    void setUp() {
        store = new SessionStore();
        dispatcher = mock(NotificationDispatcher.class);
        llm = new ScriptedLlm();
        IntentExtractor extractor = new IntentExtractor(
                new YesNoClassifier(), new EmailExtractor(), new AppointmentTimeParser(CLOCK), llm);
        machine = new ConversationStateMachine(store, extractor, ConversationScript.standard("Sarah"),
                dispatcher, new CallerProperties(), CLOCK);
    }

    @Test
    void shouldBookAppointmentOnHappyPath() {
        NextPrompt greeting = machine.start(CALL, customer());
        assertThat(greeting.getText()).contains("Hi Alex", "Sarah", "Premier Auto", "2023 Honda Accord");

        assertThat(machine.advance(CALL, "yes", 0.95).getStep()).isEqualTo(ScriptStep.CONFIRM_INTEREST);
        assertThat(machine.advance(CALL, "yeah definitely", 0.9).getStep()).isEqualTo(ScriptStep.ARRANGE_APPOINTMENT);
        NextPrompt closing = machine.advance(CALL, "tomorrow at 3pm", 0.9);

        assertThat(closing.getType()).isEqualTo(NextPrompt.Type.END_CALL);
        assertThat(closing.getText()).contains("Thursday, March 14 at 3:00 PM");
        CallSession session = dispatched();
        assertThat(session.getOutcome()).isEqualTo(CallOutcome.APPOINTMENT_SCHEDULED);
        assertThat(session.getExtractedData())
                .containsEntry(ExtractedFields.GOOD_TIME_TO_TALK, "yes")
                .containsEntry(ExtractedFields.STILL_INTERESTED, "yes")
                .containsEntry(ExtractedFields.WANTS_APPOINTMENT, "yes")
                .containsEntry(ExtractedFields.APPOINTMENT_TIME, "2024-03-14T15:00");
    }

    @Test
    void shouldOfferSimilarCarsAndCollectEmail() {
        machine.start(CALL, customer());
        machine.advance(CALL, "sure", 0.9);
        assertThat(machine.advance(CALL, "no, I already bought one", 0.9).getStep()).isEqualTo(ScriptStep.OFFER_SIMILAR);
        assertThat(machine.advance(CALL, "yes please", 0.9).getStep()).isEqualTo(ScriptStep.COLLECT_EMAIL);
        NextPrompt closing = machine.advance(CALL, "alex dot r at example dot com", 0.9);

        assertThat(closing.isEndCall()).isTrue();
        assertThat(closing.getText()).contains("alex.r@example.com");
        CallSession session = dispatched();
        assertThat(session.getOutcome()).isEqualTo(CallOutcome.INTERESTED_SIMILAR);
        assertThat(session.getExtractedData()).containsEntry(ExtractedFields.EMAIL, "alex.r@example.com");
    }

    @Test
    void shouldEndAsCallbackWhenNotAGoodTime() {
        machine.start(CALL, customer());

        NextPrompt closing = machine.advance(CALL, "not now", 0.9);

        assertThat(closing.isEndCall()).isTrue();
        assertThat(dispatched().getOutcome()).isEqualTo(CallOutcome.CALLBACK_REQUESTED);
        assertThat(CallOutcome.CALLBACK_REQUESTED.nextAction(dispatched().getExtractedData())).isEqualTo("schedule_callback");
    }

    @Test
    void shouldRepromptOnceOnLowConfidenceThenAcceptClearAnswer() {
        machine.start(CALL, customer());

        NextPrompt reprompt = machine.advance(CALL, "yes", 0.3);
        assertThat(reprompt.getType()).isEqualTo(NextPrompt.Type.REPROMPT);
        assertThat(reprompt.getStep()).isEqualTo(ScriptStep.GREETING);
        assertThat(reprompt.getText()).startsWith("I'm sorry, I didn't catch that.");

        NextPrompt next = machine.advance(CALL, "yes", 0.9);
        assertThat(next.getType()).isEqualTo(NextPrompt.Type.QUESTION);
        assertThat(next.getStep()).isEqualTo(ScriptStep.CONFIRM_INTEREST);
    }

    @Test
    void shouldRepromptWhenCustomerIsUnsureAboutInterest() {
        machine.start(CALL, customer());
        machine.advance(CALL, "yes", 0.9);

        NextPrompt reprompt = machine.advance(CALL, "I'm not sure", 0.9);

        assertThat(reprompt.getType()).isEqualTo(NextPrompt.Type.REPROMPT);
        assertThat(reprompt.getStep()).isEqualTo(ScriptStep.CONFIRM_INTEREST);
        assertThat(session().getField(ExtractedFields.STILL_INTERESTED)).isNull();

        assertThat(machine.advance(CALL, "yes I am", 0.9).getStep()).isEqualTo(ScriptStep.ARRANGE_APPOINTMENT);
    }

    @Test
    void shouldTakeUnknownBranchAfterRetriesExhausted() {
        machine.start(CALL, customer());
        machine.advance(CALL, "", 0.0);

        NextPrompt next = machine.advance(CALL, "mumble", 0.2);

        assertThat(next.getStep()).isEqualTo(ScriptStep.CONFIRM_INTEREST);
        assertThat(session().getField(ExtractedFields.GOOD_TIME_TO_TALK)).isEqualTo("unknown");
    }

    @Test
    void shouldAskForTimeWhenAppointmentAcceptedWithoutOne() {
        machine.start(CALL, customer());
        machine.advance(CALL, "yes", 0.9);
        machine.advance(CALL, "yes", 0.9);

        NextPrompt ask = machine.advance(CALL, "yes please", 0.9);
        assertThat(ask.getType()).isEqualTo(NextPrompt.Type.REPROMPT);
        assertThat(ask.getText()).isEqualTo("What date and time works best for you?");

        NextPrompt closing = machine.advance(CALL, "friday at 10:30", 0.9);
        assertThat(closing.isEndCall()).isTrue();
        assertThat(dispatched().getOutcome()).isEqualTo(CallOutcome.APPOINTMENT_SCHEDULED);
    }

    @Test
    void shouldCloseAsCallbackWhenAppointmentWantedButNoTimeGiven() {
        machine.start(CALL, customer());
        machine.advance(CALL, "yes", 0.9);
        machine.advance(CALL, "yes", 0.9);
        machine.advance(CALL, "yes please", 0.9);

        NextPrompt closing = machine.advance(CALL, "yes whenever", 0.9);

        assertThat(closing.getText()).contains("call back at a better time");
        assertThat(dispatched().getOutcome()).isEqualTo(CallOutcome.CALLBACK_REQUESTED);
    }

    @Test
    void shouldEndWithSystemErrorAfterRepeatedSpeechFailures() {
        machine.start(CALL, customer());

        assertThat(machine.advance(CALL, CustomerUtterance.failed()).getType()).isEqualTo(NextPrompt.Type.REPROMPT);
        assertThat(machine.advance(CALL, CustomerUtterance.failed()).getStep()).isEqualTo(ScriptStep.CONFIRM_INTEREST);
        NextPrompt closing = machine.advance(CALL, CustomerUtterance.failed());

        assertThat(closing.getType()).isEqualTo(NextPrompt.Type.END_CALL);
        assertThat(closing.getText()).contains("technical trouble");
        assertThat(dispatched().getOutcome()).isEqualTo(CallOutcome.SYSTEM_ERROR);
    }

    @Test
    void shouldCountLanguageModelFailuresTowardSystemError() {
        llm.failure = new TransientProviderException("openai", "timed out");
        machine.start(CALL, customer());

        machine.advance(CALL, "well it depends", 0.9);
        machine.advance(CALL, "well it depends", 0.9);
        NextPrompt closing = machine.advance(CALL, "well it depends", 0.9);

        assertThat(closing.isEndCall()).isTrue();
        assertThat(dispatched().getOutcome()).isEqualTo(CallOutcome.SYSTEM_ERROR);
    }

    @Test
    void shouldResetFailureCountAfterSuccessfulTurn() {
        machine.start(CALL, customer());
        machine.advance(CALL, CustomerUtterance.failed());
        machine.advance(CALL, "yes", 0.9);

        assertThat(session().getConsecutiveFailures()).isZero();
    }

    @Test
    void shouldDiscardAnswersAfterTerminationAndDispatchOnce() {
        machine.start(CALL, customer());
        machine.advance(CALL, "not now", 0.9);

        NextPrompt late = machine.advance(CALL, "actually yes", 0.9);

        assertThat(late.getType()).isEqualTo(NextPrompt.Type.DISCARDED);
        assertThat(machine.endCall(CALL, null, 42)).isFalse();
        verify(dispatcher, times(1)).dispatch(session());
        assertThat(session().getDuration().getSeconds()).isEqualTo(42);
    }

    @Test
    void shouldRejectMutationOfTerminalSession() {
        machine.start(CALL, customer());
        machine.advance(CALL, "not now", 0.9);

        assertThatThrownBy(() -> session().recordField(ExtractedFields.EMAIL, "x@y.com"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldDiscardAnswerArrivingAfterHangup() {
        machine.start(CALL, customer());
        session().requestHangup();

        assertThat(machine.advance(CALL, "yes", 0.9).getType()).isEqualTo(NextPrompt.Type.DISCARDED);
        verifyNoInteractions(dispatcher);
    }

    @Test
    void shouldEndSilentCallAsNoResponse() {
        machine.start(CALL, customer());

        assertThat(machine.endCall(CALL, null, 5)).isTrue();
        assertThat(dispatched().getOutcome()).isEqualTo(CallOutcome.NO_RESPONSE);
    }

    @Test
    void shouldDeriveOutcomeOfInterruptedCallFromAnswers() {
        machine.start(CALL, customer());
        machine.advance(CALL, "yes", 0.9);
        machine.advance(CALL, "no", 0.9);

        machine.endCall(CALL, null, 30);

        assertThat(dispatched().getOutcome()).isEqualTo(CallOutcome.NOT_INTERESTED);
    }

    @Test
    void shouldIgnoreDuplicateStart() {
        machine.start(CALL, customer());

        NextPrompt again = machine.start(CALL, customer());

        assertThat(again.getType()).isEqualTo(NextPrompt.Type.IGNORED);
        assertThat(session().getTurnHistory()).hasSize(1);
    }

    @Test
    void shouldLeaveVoicemailAndEndAsNoResponse() {
        store.getOrCreate(CALL, () -> new CallSession(CALL, customer(), CLOCK.instant()));

        NextPrompt message = machine.leaveVoicemail(CALL);

        assertThat(message.isEndCall()).isTrue();
        assertThat(message.getText()).contains("Please call us back");
        assertThat(dispatched().getOutcome()).isEqualTo(CallOutcome.NO_RESPONSE);
    }

    @Test
    void shouldOnlyMoveForwardThroughScript() {
        machine.start(CALL, customer());
        List<ScriptStep> steps = new ArrayList<>();
        for (String answer : List.of("", "yes", "hmm", "no", "", "yes", "", "")) {
            machine.advance(CALL, answer, 0.9);
            steps.add(session().getScriptStep());
        }

        for (int i = 1; i < steps.size(); i++) {
            assertThat(steps.get(i).isBefore(steps.get(i - 1))).isFalse();
        }
        assertThat(session().isTerminal()).isTrue();
    }

    @Test
    void shouldRecordBothSidesOfConversation() {
        machine.start(CALL, customer());
        machine.advance(CALL, "yes", 0.9);

        assertThat(session().getTurnHistory())
                .extracting(Turn::getSpeaker)
                .containsExactly(Speaker.SYSTEM, Speaker.CUSTOMER, Speaker.SYSTEM);
    }

    private CallSession session() {
        return store.find(CALL).orElseThrow();
    }

    private CallSession dispatched() {
        ArgumentCaptor<CallSession> captor = ArgumentCaptor.forClass(CallSession.class);
        verify(dispatcher, times(1)).dispatch(captor.capture());
        return captor.getValue();
    }

    private static CustomerProfile customer() {
        return new CustomerProfile(new CustomerRef("+15551230001", "CUST001"), "Alex", "2023 Honda Accord",
                "Premier Auto", null, true);
    }

    private static final class ScriptedLlm implements LlmIntentClassifier {
        RuntimeException failure;

        @Override
        public String classify(ScriptStep step, String question, String transcript, Set<String> allowedLabels) {
            if (failure != null) {
                throw failure;
            }
            return "unknown";
        }

        @Override
        public boolean isEnabled() {
            return true;
        }
    }
}
