package com.ai.studyengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Updated scheduling state of a reviewed flashcard plus the effect of the
 * review on its topic's workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlashcardReviewResponse {

    private FlashcardResponse flashcard;

    private String topicId;

    /** Stage of the card's topic after the review. */
    private String workflowStage;

    /** Topics opened because the review completed this topic. */
    private List<String> unlockedTopicIds;

    private int sessionProgress;
}
