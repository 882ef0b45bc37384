package com.ai.studyengine.service.hierarchy;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A single rule violation found in a topic proposal.
 */
@Data
@AllArgsConstructor
public class HierarchyIssue {

    public enum Kind {
        DEPTH_EXCEEDED,
        UNWORTHY_LEAF,
        DUPLICATE_SIBLINGS,
        PREREQUISITE_CYCLE,
        FIRST_LEAF_PREREQUISITE
    }

    private Kind kind;

    /** Human readable location and detail, also fed back into the retry prompt. */
    private String detail;

    public static HierarchyIssue of(Kind kind, String detail) {
        return new HierarchyIssue(kind, detail);
    }

    @Override
    public String toString() {
        return kind + ": " + detail;
    }
}
