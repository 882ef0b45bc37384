package com.ai.studyengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Size and complexity estimate of a piece of study material, with the
 * recommended generation parameters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentAnalysisResponse {

    private int wordCount;

    /** Minutes, at 225 words per minute. */
    private int estimatedReadingTime;

    private int recommendedTopics;

    private int recommendedQuestions;

    /** 0.0 (simple) to 1.0 (dense). */
    private double complexityScore;

    private double uniqueWordRatio;
    private double avgWordLength;
    private double avgSentenceLength;
}
