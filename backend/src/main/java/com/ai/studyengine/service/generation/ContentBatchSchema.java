package com.ai.studyengine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expected reply for a content batch:
 *
 * <pre>
 * {"subtopics": {"&lt;key&gt;": {"questions": [...], "flashcards": [...]}}}
 * </pre>
 *
 * Every requested key must be present with at least one well-formed
 * question. Individual malformed questions or flashcards are dropped;
 * a leaf left without any question fails the whole batch.
 */
@Slf4j
public class ContentBatchSchema implements ResponseSchema<ContentBatch> {

    static final int OPTION_COUNT = 4;

    private final List<String> expectedKeys;

    public ContentBatchSchema(List<String> expectedKeys) {
        this.expectedKeys = List.copyOf(expectedKeys);
    }

    @Override
    public String name() {
        return "content-batch";
    }

    @Override
    public ContentBatch validate(JsonNode root) throws SchemaViolationException {
        JsonNode subtopics = root.has("subtopics") ? root.get("subtopics") : root;
        if (!subtopics.isObject()) {
            throw new SchemaViolationException("'subtopics' must be an object");
        }

        Map<String, LeafContent> result = new LinkedHashMap<>();
        for (String key : expectedKeys) {
            JsonNode leaf = subtopics.get(key);
            if (leaf == null || !leaf.isObject()) {
                throw new SchemaViolationException("Missing content for topic key '" + key + "'");
            }

            List<GeneratedQuestion> questions = readQuestions(key, leaf.path("questions"));
            if (questions.isEmpty()) {
                throw new SchemaViolationException("No valid questions for topic key '" + key + "'");
            }
            result.put(key, LeafContent.builder()
                    .questions(questions)
                    .flashcards(readFlashcards(key, leaf.path("flashcards")))
                    .build());
        }
        return new ContentBatch(result);
    }

    private List<GeneratedQuestion> readQuestions(String key, JsonNode array) throws SchemaViolationException {
        if (!array.isArray()) {
            throw new SchemaViolationException("'questions' of topic key '" + key + "' must be an array");
        }
        List<GeneratedQuestion> questions = new ArrayList<>();
        int dropped = 0;
        for (JsonNode q : array) {
            GeneratedQuestion question = toQuestion(q);
            if (question != null) {
                questions.add(question);
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("Dropped {} malformed question(s) for topic key '{}'", dropped, key);
        }
        return questions;
    }

    private GeneratedQuestion toQuestion(JsonNode q) {
        if (!q.isObject() || !isText(q.get("question")) || !q.path("explanation").isTextual()) {
            return null;
        }
        JsonNode options = q.get("options");
        if (options == null || !options.isArray() || options.size() != OPTION_COUNT) {
            return null;
        }
        List<String> texts = new ArrayList<>(OPTION_COUNT);
        for (JsonNode option : options) {
            if (!isText(option))
                return null;
            texts.add(option.asText().strip());
        }
        JsonNode answer = q.get("correctAnswer");
        if (answer == null || !answer.canConvertToInt() || !answer.isIntegralNumber()) {
            return null;
        }
        int correct = answer.asInt();
        if (correct < 0 || correct >= OPTION_COUNT) {
            return null;
        }

        JsonNode page = q.get("sourcePage");
        return GeneratedQuestion.builder()
                .question(q.get("question").asText().strip())
                .options(texts)
                .correctAnswer(correct)
                .explanation(q.get("explanation").asText().strip())
                .sourceText(isText(q.get("sourceText")) ? q.get("sourceText").asText().strip() : null)
                .sourcePage(page != null && page.isIntegralNumber() ? page.asInt() : null)
                .build();
    }

    private List<GeneratedFlashcard> readFlashcards(String key, JsonNode array) {
        List<GeneratedFlashcard> cards = new ArrayList<>();
        if (!array.isArray()) {
            if (!array.isMissingNode() && !array.isNull())
                log.warn("Ignoring non-array 'flashcards' for topic key '{}'", key);
            return cards;
        }
        for (JsonNode card : array) {
            if (card.isObject() && isText(card.get("front")) && isText(card.get("back"))) {
                cards.add(GeneratedFlashcard.builder()
                        .front(card.get("front").asText().strip())
                        .back(card.get("back").asText().strip())
                        .hint(isText(card.get("hint")) ? card.get("hint").asText().strip() : null)
                        .build());
            }
        }
        return cards;
    }

    private static boolean isText(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank();
    }
}
