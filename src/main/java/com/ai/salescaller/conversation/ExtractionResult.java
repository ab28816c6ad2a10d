package com.ai.salescaller.conversation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of the extractor: the classified intent plus any structured fields found in the transcript.
 */
public final class ExtractionResult {

    public enum Source { RULES, LANGUAGE_MODEL, NONE }

    private final Intent intent;
    private final Map<String, String> fields;
    private final Source source;

    public ExtractionResult(Intent intent, Map<String, String> fields, Source source) {
        this.intent = intent != null ? intent : Intent.UNKNOWN;
        this.fields = fields == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.source = source;
    }

    public static ExtractionResult unknown() {
        return new ExtractionResult(Intent.UNKNOWN, null, Source.NONE);
    }

    public Intent getIntent() {
        return intent;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public String getField(String key) {
        return fields.get(key);
    }

    public boolean hasField(String key) {
        return fields.containsKey(key);
    }

    public Source getSource() {
        return source;
    }
}
