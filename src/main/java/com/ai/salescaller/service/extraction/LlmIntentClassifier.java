package com.ai.salescaller.service.extraction;

import com.ai.salescaller.conversation.ScriptStep;

import java.util.Set;

/**
 * Language-model fallback for answers the keyword rules could not classify.
 * Implementations must answer with one of {@code allowedLabels}; the caller still validates.
 */
public interface LlmIntentClassifier {

    /**
     * @return the raw label produced by the model
     * @throws com.ai.salescaller.exception.ProviderException when the model could not be reached
     */
    String classify(ScriptStep step, String question, String transcript, Set<String> allowedLabels);

    /** False when no credentials are configured; the extractor then treats the answer as unknown. */
    boolean isEnabled();
}
