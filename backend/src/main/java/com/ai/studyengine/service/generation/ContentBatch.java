package com.ai.studyengine.service.generation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generated content for a batch of leaves, keyed by the batch keys that
 * were sent in the prompt.
 */
public class ContentBatch {

    private final Map<String, LeafContent> byKey;

    public ContentBatch(Map<String, LeafContent> byKey) {
        this.byKey = Collections.unmodifiableMap(new LinkedHashMap<>(byKey));
    }

    public LeafContent get(String key) {
        return byKey.get(key);
    }

    public Map<String, LeafContent> asMap() {
        return byKey;
    }

    public int questionCount() {
        return byKey.values().stream().mapToInt(c -> c.getQuestions().size()).sum();
    }

    public int flashcardCount() {
        return byKey.values().stream().mapToInt(c -> c.getFlashcards().size()).sum();
    }
}
