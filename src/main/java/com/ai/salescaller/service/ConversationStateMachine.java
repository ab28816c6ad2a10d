package com.ai.salescaller.service;

import com.ai.salescaller.config.CallerProperties;
import com.ai.salescaller.conversation.CallOutcome;
import com.ai.salescaller.conversation.CallSession;
import com.ai.salescaller.conversation.ConversationScript;
import com.ai.salescaller.conversation.CustomerProfile;
import com.ai.salescaller.conversation.CustomerUtterance;
import com.ai.salescaller.conversation.ExtractedFields;
import com.ai.salescaller.conversation.ExtractionResult;
import com.ai.salescaller.conversation.Intent;
import com.ai.salescaller.conversation.NextPrompt;
import com.ai.salescaller.conversation.ScriptStep;
import com.ai.salescaller.conversation.Speaker;
import com.ai.salescaller.conversation.Turn;
import com.ai.salescaller.exception.SystemErrorException;
import com.ai.salescaller.service.dispatch.NotificationDispatcher;
import com.ai.salescaller.service.extraction.IntentExtractor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Drives one call through the sales script. Every operation runs under the session's lock, so each
 * webhook is a single {@code (state, event) -> (state', prompt)} step.
 *
 * <p>Unclear answers (low confidence, empty, provider failure, unclassifiable) re-ask the same step
 * up to {@code caller.max-retries-per-step} times, then take the step's "unknown" branch.
 * Provider and extractor failures also count toward {@code caller.max-consecutive-failures}, which
 * ends the call with {@link CallOutcome#SYSTEM_ERROR}. Entering ENDING picks the closing prompt,
 * terminates the session and hands it to the dispatcher exactly once.
 */
@Service
public class ConversationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ConversationStateMachine.class);

    private final SessionStore sessionStore;
    private final IntentExtractor extractor;
    private final ConversationScript script;
    private final NotificationDispatcher dispatcher;
    private final CallerProperties properties;
    private final Clock clock;

    public ConversationStateMachine(SessionStore sessionStore,
                                    IntentExtractor extractor,
                                    ConversationScript script,
                                    NotificationDispatcher dispatcher,
                                    CallerProperties properties,
                                    Clock clock) {
        this.sessionStore = sessionStore;
        this.extractor = extractor;
        this.script = script;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates the session for an answered call and returns the greeting. A repeated delivery for the
     * same call creates nothing and returns {@link NextPrompt.Type#IGNORED}.
     */
    public NextPrompt start(String callId, CustomerProfile customer) {
        sessionStore.getOrCreate(callId, () -> new CallSession(callId, customer, clock.instant()));
        return sessionStore.withSession(callId, session -> {
            if (session.isTerminal() || !session.getTurnHistory().isEmpty()) {
                return NextPrompt.ignored(session.getScriptStep());
            }
            String greeting = script.question(ScriptStep.GREETING, session.getCustomer());
            session.appendTurn(Turn.system(greeting, clock.instant()));
            log.info("[{}] Call started for {} ({})", callId, session.getCustomerRef(),
                    session.getCustomer().isKnown() ? "known" : "unknown customer");
            return NextPrompt.question(greeting, ScriptStep.GREETING);
        });
    }

    public NextPrompt advance(String callId, String transcript, double confidence) {
        return advance(callId, CustomerUtterance.of(transcript, confidence));
    }

    public NextPrompt advance(String callId, CustomerUtterance utterance) {
        return sessionStore.withSession(callId, session -> {
            if (session.isTerminal() || session.isHangupRequested()) {
                log.info("[{}] Answer arrived after the call ended; discarding", callId);
                return NextPrompt.discarded();
            }
            Instant now = clock.instant();
            session.touch(now);
            ScriptStep step = session.getScriptStep();
            if (!step.expectsAnswer()) {
                return NextPrompt.ignored(step);
            }
            if (!utterance.isEmpty()) {
                session.appendTurn(Turn.customer(utterance.getTranscript(), utterance.getConfidence(), now));
            }
            log.info("[{}] {} <- \"{}\" (confidence {})", callId, step,
                    StringUtils.abbreviate(utterance.getTranscript(), 100), utterance.getConfidence());

            if (utterance.isProviderFailure()) {
                if (countFailure(session)) {
                    return finish(session, CallOutcome.SYSTEM_ERROR);
                }
                return unclear(session, step);
            }
            if (utterance.isEmpty() || utterance.getConfidence() < properties.getConfidenceThreshold()) {
                return unclear(session, step);
            }

            ExtractionResult result;
            try {
                result = extractor.extract(step, script.question(step, session.getCustomer()), utterance.getTranscript());
            } catch (RuntimeException e) {
                log.warn("[{}] Extraction failed at {}: {}", callId, step, e.getMessage());
                if (countFailure(session)) {
                    return finish(session, CallOutcome.SYSTEM_ERROR);
                }
                return unclear(session, step);
            }
            session.clearFailures();
            try {
                return apply(session, step, result);
            } catch (IllegalStateException e) {
                throw new SystemErrorException("Script error at " + step + " for call " + callId, e);
            }
        });
    }

    /**
     * Records a failed synthesis. Ends the call with the apology prompt once the consecutive-failure
     * limit is reached; otherwise the turn stands.
     */
    public NextPrompt recordSpeechFailure(String callId) {
        return sessionStore.withSession(callId, session -> {
            if (session.isTerminal()) {
                return NextPrompt.ignored(session.getScriptStep());
            }
            if (countFailure(session)) {
                return finish(session, CallOutcome.SYSTEM_ERROR);
            }
            return NextPrompt.ignored(session.getScriptStep());
        });
    }

    /**
     * Answering machine picked up: leave the voicemail message and end with {@code no_response}.
     */
    public NextPrompt leaveVoicemail(String callId) {
        return sessionStore.withSession(callId, session -> {
            if (session.isTerminal()) {
                return NextPrompt.discarded();
            }
            String message = script.voicemail(session.getCustomer());
            session.appendTurn(Turn.system(message, clock.instant()));
            log.info("[{}] Answering machine detected, leaving voicemail", callId);
            terminateAndDispatch(session, CallOutcome.NO_RESPONSE);
            return NextPrompt.endCall(message);
        });
    }

    /**
     * The call ended outside the script (hangup, failure, abandonment). Terminates the session if it is
     * still live and dispatches it.
     *
     * @param outcome the outcome to record, or null to derive it from what was said so far
     * @return true when this call terminated the session
     */
    public boolean endCall(String callId, CallOutcome outcome, Integer durationSeconds) {
        return sessionStore.withSession(callId, session -> {
            session.setReportedDurationSeconds(durationSeconds);
            if (session.isTerminal()) {
                return false;
            }
            CallOutcome resolved = outcome != null ? outcome : outcomeOfInterruptedCall(session);
            log.info("[{}] Call ended at {} with outcome {}", callId, session.getScriptStep(), resolved.wireName());
            terminateAndDispatch(session, resolved);
            return true;
        });
    }

    private NextPrompt apply(CallSession session, ScriptStep step, ExtractionResult result) {
        Intent intent = result.getIntent();
        CustomerProfile customer = session.getCustomer();

        if (intent == Intent.UNKNOWN) {
            if (step == ScriptStep.COLLECT_EMAIL && canRetry(session, step)) {
                session.incrementRetries(step);
                return askAgain(session, script.askEmailAgain(customer), step);
            }
            return unclear(session, step);
        }

        if (step == ScriptStep.ARRANGE_APPOINTMENT && intent == Intent.YES
                && !result.hasField(ExtractedFields.APPOINTMENT_TIME)) {
            if (canRetry(session, step)) {
                session.incrementRetries(step);
                return askAgain(session, script.askAppointmentTime(customer), step);
            }
            log.info("[{}] No usable appointment time given; closing as callback", session.getCallId());
        }

        result.getFields().forEach(session::recordField);
        return transition(session, step, intent);
    }

    /** Re-prompt while the step has retries left, otherwise follow the unknown branch. */
    private NextPrompt unclear(CallSession session, ScriptStep step) {
        if (canRetry(session, step)) {
            session.incrementRetries(step);
            return askAgain(session, script.reprompt(step, session.getCustomer()), step);
        }
        String field = ExtractedFields.yesNoFieldFor(step);
        if (field != null) {
            session.recordField(field, ExtractedFields.UNKNOWN);
        }
        if (step == ScriptStep.COLLECT_EMAIL && session.getCustomer().getEmailOnFile() != null) {
            session.recordField(ExtractedFields.EMAIL, session.getCustomer().getEmailOnFile());
        }
        log.info("[{}] Retries exhausted at {}, taking unknown branch", session.getCallId(), step);
        return transition(session, step, Intent.UNKNOWN);
    }

    private NextPrompt transition(CallSession session, ScriptStep step, Intent intent) {
        ScriptStep next = script.next(step, intent);
        if (next == ScriptStep.ENDING) {
            return finish(session, CallOutcome.fromExtractedData(session.getExtractedData()));
        }
        session.moveTo(next);
        String question = script.question(next, session.getCustomer());
        session.appendTurn(Turn.system(question, clock.instant()));
        log.info("[{}] {} --{}--> {}", session.getCallId(), step, intent.label(), next);
        return NextPrompt.question(question, next);
    }

    private NextPrompt finish(CallSession session, CallOutcome outcome) {
        session.moveTo(ScriptStep.ENDING);
        String closing = script.closing(outcome, session.getCustomer(), session.getExtractedData());
        session.appendTurn(Turn.system(closing, clock.instant()));
        terminateAndDispatch(session, outcome);
        return NextPrompt.endCall(closing);
    }

    private void terminateAndDispatch(CallSession session, CallOutcome outcome) {
        session.terminate(outcome, clock.instant());
        log.info("[{}] Session terminal: outcome={} next_action={}", session.getCallId(),
                outcome.wireName(), outcome.nextAction(session.getExtractedData()));
        if (session.markDispatched()) {
            dispatcher.dispatch(session);
        }
    }

    private NextPrompt askAgain(CallSession session, String text, ScriptStep step) {
        session.appendTurn(Turn.system(text, clock.instant()));
        return NextPrompt.reprompt(text, step);
    }

    private boolean canRetry(CallSession session, ScriptStep step) {
        return session.retriesAt(step) < properties.getMaxRetriesPerStep();
    }

    /** @return true when the failure limit has been reached */
    private boolean countFailure(CallSession session) {
        int failures = session.recordFailure();
        log.warn("[{}] Consecutive failure {}/{}", session.getCallId(), failures, properties.getMaxConsecutiveFailures());
        return failures >= properties.getMaxConsecutiveFailures();
    }

    private CallOutcome outcomeOfInterruptedCall(CallSession session) {
        boolean customerSpoke = session.getTurnHistory().stream()
                .anyMatch(t -> t.getSpeaker() == Speaker.CUSTOMER);
        if (!customerSpoke) {
            return CallOutcome.NO_RESPONSE;
        }
        Map<String, String> data = session.getExtractedData();
        return CallOutcome.fromExtractedData(data);
    }
}
