package com.ai.salescaller.service.extraction;

import com.ai.salescaller.conversation.Intent;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies customer utterances into YES, NO, or UNKNOWN with keyword rules.
 * Mixed signals ("sure, but not now") and hedges ("I'm not sure", "I don't know") stay UNKNOWN
 * so the language model can look at them.
 */
@Component
public class YesNoClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "yeah", "yep", "ya", "yup", "uh huh", "uh-huh", "ok", "okay", "sure",
            "correct", "right", "absolutely", "definitely", "certainly", "of course", "go ahead",
            "sounds good", "please do", "why not"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "nope", "nah", "never mind", "nevermind", "not now", "not yet", "not really",
            "no thanks", "no thank you", "not interested", "busy"
    );

    /** Uncertain answers. They contain "sure" or "don't" but are neither yes nor no. */
    private static final Pattern HEDGE = Pattern.compile(
            "\\b(not (so |too |really |quite |entirely )?sure|unsure|not certain|(don't|do not|dont) know|"
                    + "no idea|maybe|perhaps|i guess|not right(?! (now|at the moment))|"
                    + "(i'll|i will|let me|need to|have to) think|depends)\\b",
            Pattern.CASE_INSENSITIVE
    );

    /** These contain positive words ("interested", "good time", "right") but mean no. */
    private static final Pattern NEGATED_POSITIVE = Pattern.compile(
            "\\b(not (really |that |very )?interested|not right (now|at the moment)|no longer (interested|looking)|not (a )?good time|"
                    + "(don't|do not|dont) (want|need|think)|(isn't|is not|not) a good time|not anymore|"
                    + "(already|just) (bought|got|purchased))\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(yes|yeah|yep|ya|yup|ok|okay|sure|correct|right|absolutely|definitely|certainly|of course|"
                    + "sounds good|go ahead|interested|still looking|good time|perfect|great|fine|"
                    + "i would|i'd like|i'd love|i am|i'm in|let's do)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(no|nope|nah|never|not now|not yet|not really|busy|later|bad time|call (me )?back|"
                    + "another time|can't|cannot|won't|don't|dont)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public Intent classify(String utterance) {
        if (StringUtils.isBlank(utterance)) {
            return Intent.UNKNOWN;
        }
        String normalized = utterance.trim().toLowerCase(Locale.ROOT).replaceAll("[.!?,]+$", "");

        if (normalized.length() <= 20) {
            if (AFFIRMATIVE_EXACT.contains(normalized)) {
                return Intent.YES;
            }
            if (NEGATIVE_EXACT.contains(normalized)) {
                return Intent.NO;
            }
        }

        if (HEDGE.matcher(normalized).find()) {
            return Intent.UNKNOWN;
        }

        boolean negatedPositive = NEGATED_POSITIVE.matcher(normalized).find();
        boolean yes = !negatedPositive && AFFIRMATIVE_PATTERN.matcher(normalized).find();
        boolean no = negatedPositive || NEGATIVE_PATTERN.matcher(normalized).find();

        if (yes && !no) return Intent.YES;
        if (no && !yes) return Intent.NO;
        return Intent.UNKNOWN;
    }
}
