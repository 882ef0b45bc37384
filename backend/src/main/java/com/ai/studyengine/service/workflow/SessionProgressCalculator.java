package com.ai.studyengine.service.workflow;

import com.ai.studyengine.model.Topic;
import com.ai.studyengine.model.WorkflowStage;

import java.util.List;

/**
 * Session completion percentage: completed leaves over all leaves.
 */
public final class SessionProgressCalculator {

    private SessionProgressCalculator() {
    }

    public static int progressOf(List<Topic> leaves) {
        if (leaves.isEmpty())
            return 0;
        long completed = leaves.stream()
                .filter(t -> t.getWorkflowStage() == WorkflowStage.COMPLETED)
                .count();
        return (int) Math.round(completed * 100.0 / leaves.size());
    }
}
