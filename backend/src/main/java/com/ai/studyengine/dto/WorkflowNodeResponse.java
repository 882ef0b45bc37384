package com.ai.studyengine.dto;

import com.ai.studyengine.model.Topic;
import com.ai.studyengine.model.WorkflowStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of the skill-tree view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowNodeResponse {

    private String id;
    private String parentId;
    private String title;
    private String description;
    private boolean category;
    private int depth;
    private int orderIndex;
    private Double positionX;
    private Double positionY;
    private String workflowStage;
    private List<String> prerequisiteTopicIds;
    private int questionCount;
    private int flashcardCount;
    private Integer score;

    /** Quiz passed: topic is in flashcard review or completed. */
    private boolean quizCompleted;

    private boolean flashcardsCompleted;

    public static WorkflowNodeResponse from(Topic topic) {
        WorkflowStage stage = topic.getWorkflowStage();
        return WorkflowNodeResponse.builder()
                .id(topic.getId())
                .parentId(topic.getParent() != null ? topic.getParent().getId() : null)
                .title(topic.getTitle())
                .description(topic.getDescription())
                .category(topic.isCategory())
                .depth(topic.getDepth())
                .orderIndex(topic.getOrderIndex())
                .positionX(topic.getPositionX())
                .positionY(topic.getPositionY())
                .workflowStage(stage != null ? stage.wireName() : null)
                .prerequisiteTopicIds(new ArrayList<>(topic.getPrerequisiteTopicIds()))
                .questionCount(topic.getQuestions().size())
                .flashcardCount(topic.getFlashcards().size())
                .score(topic.getScore())
                .quizCompleted(stage == WorkflowStage.FLASHCARD_REVIEW || stage == WorkflowStage.COMPLETED)
                .flashcardsCompleted(stage == WorkflowStage.COMPLETED)
                .build();
    }
}
