package com.ai.studyengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicFlashcardsResponse {

    private String topicId;
    private String topicTitle;
    private String workflowStage;
    private List<FlashcardResponse> flashcards;
    private int totalFlashcards;
    private int dueCount;

    /** Cards reviewed since the topic entered flashcard review. */
    private int reviewedInCurrentPass;
}
