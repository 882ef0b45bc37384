package com.ai.studyengine.service.generation;

import com.ai.studyengine.dto.ContentAnalysisResponse;
import com.ai.studyengine.model.Topic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the prompts for topic proposals and content batches.
 */
@Slf4j
@Component
public class GenerationPrompts {

    @Value("${study.generation.max-source-chars:80000}")
    private int maxSourceChars;

    @Value("${study.generation.flashcards-per-topic:10}")
    private int flashcardsPerTopic;

    /**
     * Prompt asking for a nested topic hierarchy.
     *
     * @param problems issues found in the previous proposal; empty on the first request
     */
    public String topicProposalPrompt(String sourceText, ContentAnalysisResponse analysis,
                                      int leafCount, int maxDepth, List<String> problems) {
        int categoryCount = Math.max(1, Math.min(8, (int) Math.round(leafCount / 3.0)));
        String corrections = problems.isEmpty() ? "" : """

                YOUR PREVIOUS STRUCTURE WAS REJECTED. Fix every problem below:
                %s
                Every leaf needs a specific title and a description of at least one full sentence.
                Sibling titles must not share the same key words.
                """.formatted(problems.stream().map(p -> "- " + p).collect(Collectors.joining("\n")));

        return """
                Analyze this study material and organize it into a clear, focused hierarchical structure.

                Study Material:
                %s

                Content Analysis:
                - Word Count: %d
                - Complexity Score: %.2f
                - Estimated Reading Time: %d minutes

                Requirements:
                1. Create approximately %d major categories that organize the content at a high level.
                2. Create approximately %d LEAF topics in total. Leaves are the topics that get questions.
                3. Never nest deeper than %d levels (category, subtopic, leaf).
                4. Each leaf must be a focused concept that can support many quality questions.
                5. Give every topic a clear title and a one-sentence description.
                6. Order topics from foundational to advanced.
                7. Sibling topics must be distinct and must not overlap. Never repeat a topic.
                8. Optionally list, for a leaf, the titles of EARLIER leaves that must be learned first.
                   The first leaf never has prerequisites and prerequisites never form a loop.
                %s
                Return ONLY a valid JSON object in this EXACT format:
                {
                  "title": "Short title for the whole material",
                  "categories": [
                    {
                      "title": "Category Title",
                      "description": "Brief description of this category",
                      "subtopics": [
                        {
                          "title": "Focused Leaf Topic",
                          "description": "Brief description of the testable concept",
                          "subtopics": [],
                          "prerequisites": []
                        }
                      ]
                    }
                  ]
                }

                An EMPTY subtopics array means the topic is a LEAF.
                """.formatted(truncate(sourceText), analysis.getWordCount(), analysis.getComplexityScore(),
                analysis.getEstimatedReadingTime(), categoryCount, leafCount, maxDepth, corrections);
    }

    /**
     * Prompt asking for questions and flashcards for a batch of leaves.
     *
     * @param leavesByKey leaves of the batch keyed by the key the reply must use
     */
    public String contentBatchPrompt(String sourceText, Map<String, Topic> leavesByKey, int questionsPerTopic) {
        String topicList = leavesByKey.entrySet().stream()
                .map(e -> "- Key \"%s\": %s%s".formatted(e.getKey(), path(e.getValue()),
                        e.getValue().getDescription() != null ? " (" + e.getValue().getDescription() + ")" : ""))
                .collect(Collectors.joining("\n"));

        return """
                Generate challenging multiple-choice questions AND flashcards for EACH of the following
                topics from the study material.

                Study Material:
                %s

                TOPICS TO COVER (%d topics in this batch):
                %s

                Requirements:
                1. Generate %d questions for EACH topic and %d flashcards for EACH topic.
                2. Each question has exactly 4 plausible options and one correct answer.
                3. correctAnswer is the 0-based index (0, 1, 2 or 3) of the correct option, as an integer.
                4. Explanations say why the correct answer is right and why the distractors are wrong.
                5. sourceText is the VERBATIM passage (2-4 sentences) from the material that contains the answer.
                6. sourcePage is the estimated page number, or null.
                7. Flashcards cover key definitions, concepts and terms; hint is an optional memory aid or null.
                8. No duplicate questions. If the material is light on a topic, use its title and description.
                9. Every topic key listed above MUST appear in the reply.

                Return ONLY a valid JSON object in this EXACT format, using the topic keys exactly as shown:
                {
                  "subtopics": {
                    "%s": {
                      "questions": [
                        {
                          "question": "Question text?",
                          "options": ["Option A", "Option B", "Option C", "Option D"],
                          "correctAnswer": 0,
                          "explanation": "Why this answer is correct",
                          "sourceText": "Passage from the study material.",
                          "sourcePage": null
                        }
                      ],
                      "flashcards": [
                        {"front": "Term or question", "back": "Definition or answer", "hint": null}
                      ]
                    }
                  }
                }
                """.formatted(truncate(sourceText), leavesByKey.size(), topicList,
                questionsPerTopic, flashcardsPerTopic, leavesByKey.keySet().iterator().next());
    }

    private String path(Topic topic) {
        StringBuilder sb = new StringBuilder(topic.getTitle());
        for (Topic p = topic.getParent(); p != null; p = p.getParent()) {
            sb.insert(0, p.getTitle() + " > ");
        }
        return sb.toString();
    }

    private String truncate(String text) {
        if (text.length() <= maxSourceChars)
            return text;
        log.warn("Source text truncated from {} to {} characters.", text.length(), maxSourceChars);
        return text.substring(0, maxSourceChars) + "\n\n[... content truncated due to length ...]";
    }
}
