package com.ai.studyengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one "generate more" call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateMoreResponse {

    private String sessionId;

    /** Leaves filled by this call. */
    private int generated;

    /** Leaves still lacking content after this call. */
    private int remaining;

    /** Questions created by this call. */
    private int totalQuestions;

    /** Flashcards created by this call. */
    private int totalFlashcards;

    private boolean hasMore;
}
