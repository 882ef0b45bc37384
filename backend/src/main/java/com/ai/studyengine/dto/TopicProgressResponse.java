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
public class TopicProgressResponse {

    private String topicId;
    private Integer score;
    private int currentQuestionIndex;
    private boolean completed;
    private String workflowStage;
    private List<String> unlockedTopicIds;
    private int sessionProgress;
}
