package com.ai.studyengine.exception;

import com.ai.studyengine.service.hierarchy.HierarchyIssue;

import java.util.List;

/**
 * A proposed topic hierarchy violates structural or quality rules.
 * Recovered internally by re-prompting; only escapes when no usable
 * hierarchy could be produced at all.
 */
public class HierarchyValidationException extends RuntimeException {

    private final List<HierarchyIssue> issues;

    public HierarchyValidationException(String message, List<HierarchyIssue> issues) {
        super(message);
        this.issues = List.copyOf(issues);
    }

    public List<HierarchyIssue> getIssues() {
        return issues;
    }
}
