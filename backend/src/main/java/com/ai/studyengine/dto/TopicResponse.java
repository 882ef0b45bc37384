package com.ai.studyengine.dto;

import com.ai.studyengine.model.Topic;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One node of a session's topic tree, with its content and children.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicResponse {

    private String id;
    private String parentId;
    private String title;
    private String description;
    private boolean category;
    private int depth;
    private int orderIndex;
    private Double positionX;
    private Double positionY;

    /** Wire name such as "quiz_available"; null for categories. */
    private String workflowStage;

    private List<String> prerequisiteTopicIds;
    private Integer score;
    private int currentQuestionIndex;
    private boolean completed;

    /** True for a leaf still waiting for generated content. */
    private boolean pendingContent;

    private List<QuestionResponse> questions;
    private List<FlashcardResponse> flashcards;
    private List<TopicResponse> children;

    public static TopicResponse from(Topic topic, LocalDateTime now) {
        return TopicResponse.builder()
                .id(topic.getId())
                .parentId(topic.getParent() != null ? topic.getParent().getId() : null)
                .title(topic.getTitle())
                .description(topic.getDescription())
                .category(topic.isCategory())
                .depth(topic.getDepth())
                .orderIndex(topic.getOrderIndex())
                .positionX(topic.getPositionX())
                .positionY(topic.getPositionY())
                .workflowStage(topic.getWorkflowStage() != null ? topic.getWorkflowStage().wireName() : null)
                .prerequisiteTopicIds(new ArrayList<>(topic.getPrerequisiteTopicIds()))
                .score(topic.getScore())
                .currentQuestionIndex(topic.getCurrentQuestionIndex())
                .completed(topic.isCompleted())
                .pendingContent(topic.needsContent())
                .questions(topic.getQuestions().stream().map(QuestionResponse::from).toList())
                .flashcards(topic.getFlashcards().stream().map(f -> FlashcardResponse.from(f, now)).toList())
                .children(topic.getChildren().stream().map(c -> TopicResponse.from(c, now)).toList())
                .build();
    }
}
