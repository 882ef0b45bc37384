package com.ai.studyengine.exception;

import com.ai.studyengine.service.hierarchy.HierarchyIssue;

import java.util.List;

/**
 * Prerequisite references among leaf topics form a cycle, which would
 * leave the topics on it locked forever.
 */
public class PrerequisiteCycleException extends HierarchyValidationException {

    public PrerequisiteCycleException(List<String> cycle) {
        super("Prerequisite cycle: " + String.join(" -> ", cycle),
                List.of(HierarchyIssue.of(HierarchyIssue.Kind.PREREQUISITE_CYCLE, String.join(" -> ", cycle))));
    }
}
