package com.ai.salescaller.service;

import com.ai.salescaller.config.CallerProperties;
import com.ai.salescaller.conversation.CallOutcome;
import com.ai.salescaller.conversation.CallSession;
import com.ai.salescaller.conversation.ConversationScript;
import com.ai.salescaller.conversation.CustomerProfile;
import com.ai.salescaller.conversation.CustomerRef;
import com.ai.salescaller.conversation.CustomerUtterance;
import com.ai.salescaller.conversation.NextPrompt;
import com.ai.salescaller.dto.VoiceDirective;
import com.ai.salescaller.exception.ProviderException;
import com.ai.salescaller.exception.UnknownSessionException;
import com.ai.salescaller.service.record.CustomerRecord;
import com.ai.salescaller.service.record.PhoneNumbers;
import com.ai.salescaller.service.record.RecordStore;
import com.ai.salescaller.service.speech.RecordedAudio;
import com.ai.salescaller.service.speech.SpeechServiceAdapter;
import com.ai.salescaller.service.speech.SynthesisResult;
import com.ai.salescaller.service.speech.TranscriptionResult;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Glue between the telephony webhooks and the conversation engine: loads the customer, feeds answers
 * to the state machine and turns its prompts into audio.
 *
 * <p>A turn holds the session lock from state transition through synthesis, so a duplicate
 * webhook for the same call waits and then replays the stored directive.
 */
@Service
public class CallFlowService {

    private static final Logger log = LoggerFactory.getLogger(CallFlowService.class);

    private final ConversationStateMachine stateMachine;
    private final SessionStore sessionStore;
    private final SpeechServiceAdapter speech;
    private final RecordStore recordStore;
    private final TwilioService twilio;
    private final ConversationScript script;
    private final CallerProperties properties;
    private final Clock clock;

    public CallFlowService(ConversationStateMachine stateMachine,
                           SessionStore sessionStore,
                           SpeechServiceAdapter speech,
                           RecordStore recordStore,
                           TwilioService twilio,
                           ConversationScript script,
                           CallerProperties properties,
                           Clock clock) {
        this.stateMachine = stateMachine;
        this.sessionStore = sessionStore;
        this.speech = speech;
        this.recordStore = recordStore;
        this.twilio = twilio;
        this.script = script;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Places an outbound call and registers its session right away, so a busy or unanswered call
     * still produces an outcome.
     */
    public String placeCall(String phoneNumber) {
        String phone = PhoneNumbers.normalize(phoneNumber);
        CustomerProfile profile = loadProfile(phone);
        String callSid = twilio.placeCall(phone);
        sessionStore.getOrCreate(callSid, () -> new CallSession(callSid, profile, clock.instant()));
        return callSid;
    }

    /**
     * Places an outbound call to a customer already read from the record store.
     */
    public String placeCall(CustomerRecord customer) {
        String phone = PhoneNumbers.normalize(customer.getPhone());
        CustomerProfile profile = profileOf(customer, phone);
        String callSid = twilio.placeCall(phone);
        sessionStore.getOrCreate(callSid, () -> new CallSession(callSid, profile, clock.instant()));
        return callSid;
    }

    /**
     * Ends a live call on request: asks the telephony provider to hang up, then ends the session with
     * the outcome derived from what was said so far.
     *
     * @return true when the provider confirmed the hangup
     * @throws UnknownSessionException when the call has no live session
     */
    public boolean endCall(String callSid) {
        CallSession session = sessionStore.find(callSid).orElseThrow(() -> new UnknownSessionException(callSid));
        session.requestHangup();
        boolean hungUp = true;
        try {
            twilio.hangUp(callSid);
        } catch (ProviderException e) {
            hungUp = false;
            log.warn("[{}] Provider hangup failed, ending the session anyway: {}", callSid, e.getMessage());
        }
        try {
            stateMachine.endCall(callSid, null, null);
        } catch (UnknownSessionException e) {
            log.debug("[{}] Session delivered and evicted before the end request", callSid);
        }
        return hungUp;
    }

    /**
     * Call answered. Outbound calls are identified by {@code To}, inbound ones by {@code From}.
     * A call that already ended gets a bare hangup instead of a second greeting.
     */
    public VoiceDirective callAnswered(String callSid, String from, String to, String direction, String answeredBy) {
        boolean outbound = direction == null || direction.toLowerCase(Locale.ROOT).startsWith("outbound");
        String customerPhone = PhoneNumbers.normalize(outbound ? to : from);
        if (sessionStore.isFinished(callSid)) {
            log.info("[{}] Answer webhook for a call that already ended; hanging up", callSid);
            return VoiceDirective.hangupOnly();
        }
        if (sessionStore.find(callSid).isEmpty()) {
            CustomerProfile profile = loadProfile(customerPhone);
            sessionStore.getOrCreate(callSid, () -> new CallSession(callSid, profile, clock.instant()));
        }

        return sessionStore.withSession(callSid, session -> {
            if (session.getLastDirective() != null) {
                log.info("[{}] Repeated answer webhook; replaying last response", callSid);
                return session.getLastDirective();
            }
            if (isMachine(answeredBy)) {
                NextPrompt voicemail = stateMachine.leaveVoicemail(callSid);
                return respond(session, voicemail);
            }
            NextPrompt greeting = stateMachine.start(callSid, session.getCustomer());
            if (greeting.getType() == NextPrompt.Type.IGNORED) {
                // session was registered at placement and greeted by a request that failed mid-way
                greeting = NextPrompt.question(script.question(session.getScriptStep(), session.getCustomer()), session.getScriptStep());
            }
            return respond(session, greeting);
        });
    }

    /**
     * The customer answered. Twilio's own recognizer result is used when present; otherwise the
     * recording goes through the speech adapter.
     */
    public VoiceDirective customerSpoke(String callSid, String speechResult, String confidence, String recordingUrl) {
        CustomerUtterance utterance;
        if (StringUtils.isNotBlank(speechResult)) {
            utterance = CustomerUtterance.of(speechResult, parseConfidence(confidence));
        } else if (StringUtils.isNotBlank(recordingUrl)) {
            TranscriptionResult result = speech.transcribe(
                    new RecordedAudio(recordingUrl, "audio/wav", () -> twilio.fetchRecording(recordingUrl)));
            utterance = result.isProviderFailure()
                    ? CustomerUtterance.failed()
                    : CustomerUtterance.of(result.getTranscript(), result.getConfidence());
        } else {
            utterance = CustomerUtterance.of("", 0.0);
        }

        return sessionStore.withSession(callSid, session -> respond(session, stateMachine.advance(callSid, utterance)));
    }

    /**
     * Status callback. Final statuses end the session; the hangup flag is raised first, without the
     * session lock, so a turn still in flight discards its prompt.
     */
    public void callStatus(String callSid, String status, Integer durationSeconds) {
        Optional<CallSession> session = sessionStore.find(callSid);
        if (session.isEmpty()) {
            log.debug("[{}] Status {} for unknown or finished call", callSid, status);
            return;
        }
        String normalized = StringUtils.defaultString(status).toLowerCase(Locale.ROOT);
        try {
            switch (normalized) {
                case "completed":
                case "canceled":
                    session.get().requestHangup();
                    stateMachine.endCall(callSid, null, durationSeconds);
                    break;
                case "failed":
                case "busy":
                case "no-answer":
                    session.get().requestHangup();
                    stateMachine.endCall(callSid, CallOutcome.CALL_FAILED, durationSeconds);
                    break;
                default:
                    log.debug("[{}] Ignoring interim status {}", callSid, status);
            }
        } catch (UnknownSessionException e) {
            log.debug("[{}] Session delivered and evicted before status {}", callSid, status);
        }
    }

    /**
     * Last resort for a webhook that failed unexpectedly: ends the session with {@code system_error}
     * and returns the apology to speak. Works for calls we no longer (or never) knew about.
     */
    public String abortCall(String callSid) {
        Optional<CallSession> session = callSid == null ? Optional.empty() : sessionStore.find(callSid);
        if (session.isEmpty()) {
            return script.closing(CallOutcome.SYSTEM_ERROR, anonymousProfile(null), Map.of());
        }
        try {
            stateMachine.endCall(callSid, CallOutcome.SYSTEM_ERROR, null);
        } catch (RuntimeException e) {
            log.error("[{}] Could not record system_error outcome", callSid, e);
        }
        return script.closing(CallOutcome.SYSTEM_ERROR, session.get().getCustomer(), Map.of());
    }

    private VoiceDirective respond(CallSession session, NextPrompt prompt) {
        switch (prompt.getType()) {
            case DISCARDED:
                return VoiceDirective.hangupOnly();
            case IGNORED:
                return session.getLastDirective() != null ? session.getLastDirective() : VoiceDirective.empty();
            default:
                break;
        }
        if (session.isHangupRequested()) {
            log.info("[{}] Caller hung up during the turn; prompt discarded", session.getCallId());
            return VoiceDirective.hangupOnly();
        }

        NextPrompt spoken = prompt;
        SynthesisResult audio = speech.synthesize(spoken.getText());
        if (audio.isProviderFailure() && !spoken.isEndCall()) {
            NextPrompt afterFailure = stateMachine.recordSpeechFailure(session.getCallId());
            if (afterFailure.isEndCall()) {
                spoken = afterFailure;
                audio = speech.synthesize(spoken.getText());
            }
        }
        log.info("[{}] -> {} \"{}\"{}", session.getCallId(), spoken.getType(),
                StringUtils.abbreviate(spoken.getText(), 100), audio.getAudio().isDegraded() ? " (degraded)" : "");

        VoiceDirective directive = spoken.isEndCall()
                ? VoiceDirective.sayAndHangup(audio.getAudio())
                : VoiceDirective.gather(audio.getAudio());
        session.setLastDirective(directive);
        return directive;
    }

    private CustomerProfile loadProfile(String phone) {
        Optional<CustomerRecord> record = Optional.empty();
        try {
            record = recordStore.findByPhone(phone);
        } catch (ProviderException e) {
            log.warn("Customer lookup for {} failed, continuing as unknown customer: {}", PhoneNumbers.mask(phone), e.getMessage());
        }
        return record.map(r -> profileOf(r, phone)).orElseGet(() -> anonymousProfile(phone));
    }

    private CustomerProfile profileOf(CustomerRecord r, String phone) {
        return new CustomerProfile(
                new CustomerRef(phone, r.getRecordKey()),
                StringUtils.defaultIfBlank(r.getName(), properties.getDefaultCustomerName()),
                StringUtils.defaultIfBlank(r.getCarModel(), properties.getDefaultCarModel()),
                properties.getDealershipName(),
                r.getEmail(),
                true);
    }

    private CustomerProfile anonymousProfile(String phone) {
        return new CustomerProfile(
                new CustomerRef(phone, PhoneNumbers.unknownCustomerKey(phone)),
                properties.getDefaultCustomerName(),
                properties.getDefaultCarModel(),
                properties.getDealershipName(),
                null,
                false);
    }

    private static boolean isMachine(String answeredBy) {
        if (answeredBy == null) {
            return false;
        }
        String a = answeredBy.toLowerCase(Locale.ROOT);
        return a.startsWith("machine") || a.equals("fax");
    }

    /**
     * Twilio sometimes omits Confidence; a recognized phrase without one is taken as heard.
     * Unparseable and non-finite values count as not heard; the rest is clamped to [0, 1].
     */
    static double parseConfidence(String confidence) {
        if (StringUtils.isBlank(confidence)) {
            return 1.0;
        }
        double value;
        try {
            value = Double.parseDouble(confidence.trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
