package com.ai.salescaller.service.extraction;

import com.ai.salescaller.conversation.ExtractedFields;
import com.ai.salescaller.conversation.ExtractionResult;
import com.ai.salescaller.conversation.Intent;
import com.ai.salescaller.conversation.ScriptStep;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a transcript into an intent plus structured fields for the current step.
 *
 * <p>Rules run first. Only yes/no answers the rules cannot settle go to the language model,
 * whose label must be one of the step's allowed labels or it is coerced to unknown. Emails and
 * appointment times always come from the parsers, never from model output.
 */
@Service
public class IntentExtractor {

    private static final Logger log = LoggerFactory.getLogger(IntentExtractor.class);

    private static final Set<String> YES_NO_LABELS = Set.of(
            Intent.YES.label(), Intent.NO.label(), Intent.UNKNOWN.label());

    private final YesNoClassifier yesNoClassifier;
    private final EmailExtractor emailExtractor;
    private final AppointmentTimeParser timeParser;
    private final LlmIntentClassifier llm;

    public IntentExtractor(YesNoClassifier yesNoClassifier,
                           EmailExtractor emailExtractor,
                           AppointmentTimeParser timeParser,
                           LlmIntentClassifier llm) {
        this.yesNoClassifier = yesNoClassifier;
        this.emailExtractor = emailExtractor;
        this.timeParser = timeParser;
        this.llm = llm;
    }

    /**
     * @param question the prompt the customer was answering, given to the model as context
     */
    public ExtractionResult extract(ScriptStep step, String question, String transcript) {
        if (StringUtils.isBlank(transcript) || !step.expectsAnswer()) {
            return ExtractionResult.unknown();
        }
        switch (step) {
            case ARRANGE_APPOINTMENT:
                return extractAppointment(step, question, transcript);
            case COLLECT_EMAIL:
                return extractEmail(transcript);
            default:
                return extractYesNo(step, question, transcript);
        }
    }

    private ExtractionResult extractYesNo(ScriptStep step, String question, String transcript) {
        Intent intent = yesNoClassifier.classify(transcript);
        ExtractionResult.Source source = ExtractionResult.Source.RULES;
        if (intent == Intent.UNKNOWN) {
            intent = askModel(step, question, transcript);
            source = intent == Intent.UNKNOWN ? ExtractionResult.Source.NONE : ExtractionResult.Source.LANGUAGE_MODEL;
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(ExtractedFields.yesNoFieldFor(step), intent.label());
        return new ExtractionResult(intent, fields, source);
    }

    /** A concrete time implies yes unless the customer also said no. */
    private ExtractionResult extractAppointment(ScriptStep step, String question, String transcript) {
        Optional<AppointmentTime> time = timeParser.parse(transcript);
        Intent ruled = yesNoClassifier.classify(transcript);
        if (time.isPresent() && ruled != Intent.NO) {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(ExtractedFields.WANTS_APPOINTMENT, ExtractedFields.YES);
            fields.put(ExtractedFields.APPOINTMENT_TIME, time.get().iso());
            fields.put(ExtractedFields.APPOINTMENT_TIME_SPOKEN, time.get().spoken());
            return new ExtractionResult(Intent.YES, fields, ExtractionResult.Source.RULES);
        }
        return extractYesNo(step, question, transcript);
    }

    private ExtractionResult extractEmail(String transcript) {
        Optional<String> email = emailExtractor.extract(transcript);
        if (email.isPresent()) {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(ExtractedFields.EMAIL, email.get().toLowerCase(Locale.ROOT));
            return new ExtractionResult(Intent.YES, fields, ExtractionResult.Source.RULES);
        }
        Intent intent = yesNoClassifier.classify(transcript);
        if (intent == Intent.NO) {
            return new ExtractionResult(Intent.NO, null, ExtractionResult.Source.RULES);
        }
        // "yes" without an address is not an answer to this question
        return ExtractionResult.unknown();
    }

    private Intent askModel(ScriptStep step, String question, String transcript) {
        if (!llm.isEnabled()) {
            return Intent.UNKNOWN;
        }
        String label = llm.classify(step, question, transcript, YES_NO_LABELS);
        Optional<Intent> parsed = Intent.fromLabel(StringUtils.strip(label, " .!\"'"));
        if (parsed.isEmpty() || !YES_NO_LABELS.contains(parsed.get().label())) {
            log.warn("Language model returned unexpected label '{}' at step {}; treating as unknown",
                    StringUtils.abbreviate(label, 40), step);
            return Intent.UNKNOWN;
        }
        return parsed.get();
    }
}
