package com.ai.studyengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WebSocket message sent to /topic/sessions/{sessionId} while the remaining
 * leaves of a session are generated in the background.
 *
 * <pre>
 * ┌──────────────────────┬──────────────────────────────────────────────┐
 * │ type                 │ Payload fields                               │
 * ├──────────────────────┼──────────────────────────────────────────────┤
 * │ GENERATION_STARTED   │ remaining                                    │
 * │ GENERATION_BATCH     │ generated, remaining, totalQuestions, ...    │
 * │ GENERATION_COMPLETED │ remaining (0)                                │
 * │ GENERATION_ERROR     │ error, remaining                             │
 * └──────────────────────┴──────────────────────────────────────────────┘
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL) // omit null fields from JSON
public class GenerationStreamMessage {

    /**
     * Message type discriminator.
     * One of: GENERATION_STARTED, GENERATION_BATCH, GENERATION_COMPLETED, GENERATION_ERROR
     */
    private String type;

    /** The session this message belongs to. Always present. */
    private String sessionId;

    private Integer generated;
    private Integer remaining;
    private Integer totalQuestions;
    private Integer totalFlashcards;

    /** Error description (only for GENERATION_ERROR). */
    private String error;

    // ── Static factory methods for clean construction ────────────────────

    public static GenerationStreamMessage started(String sessionId, int remaining) {
        return GenerationStreamMessage.builder()
                .type("GENERATION_STARTED")
                .sessionId(sessionId)
                .remaining(remaining)
                .build();
    }

    public static GenerationStreamMessage batch(GenerateMoreResponse result) {
        return GenerationStreamMessage.builder()
                .type("GENERATION_BATCH")
                .sessionId(result.getSessionId())
                .generated(result.getGenerated())
                .remaining(result.getRemaining())
                .totalQuestions(result.getTotalQuestions())
                .totalFlashcards(result.getTotalFlashcards())
                .build();
    }

    public static GenerationStreamMessage completed(String sessionId) {
        return GenerationStreamMessage.builder()
                .type("GENERATION_COMPLETED")
                .sessionId(sessionId)
                .remaining(0)
                .build();
    }

    public static GenerationStreamMessage error(String sessionId, int remaining, String error) {
        return GenerationStreamMessage.builder()
                .type("GENERATION_ERROR")
                .sessionId(sessionId)
                .remaining(remaining)
                .error(error)
                .build();
    }
}
