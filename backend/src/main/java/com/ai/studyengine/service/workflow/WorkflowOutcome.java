package com.ai.studyengine.service.workflow;

import com.ai.studyengine.model.WorkflowStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a learner action on a topic: its stage afterwards and any
 * topics the action unlocked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowOutcome {

    private WorkflowStage stage;

    @Builder.Default
    private List<String> unlockedTopicIds = new ArrayList<>();

    private int sessionProgress;
}
