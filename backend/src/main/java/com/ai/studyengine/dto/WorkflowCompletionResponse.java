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
public class WorkflowCompletionResponse {

    private String topicId;
    private String workflowStage;
    private List<String> unlockedTopicIds;
    private int sessionProgress;
}
