package com.ai.studyengine.model;

/**
 * Mastery stages of a leaf topic. A topic only ever moves to the stage
 * immediately after its current one.
 */
public enum WorkflowStage {

    LOCKED,
    QUIZ_AVAILABLE,
    FLASHCARD_REVIEW,
    COMPLETED;

    /** The only stage this one may advance to, or null for COMPLETED. */
    public WorkflowStage next() {
        return switch (this) {
            case LOCKED -> QUIZ_AVAILABLE;
            case QUIZ_AVAILABLE -> FLASHCARD_REVIEW;
            case FLASHCARD_REVIEW -> COMPLETED;
            case COMPLETED -> null;
        };
    }

    public boolean canAdvanceTo(WorkflowStage target) {
        return target != null && target == next();
    }

    /** Lower-case wire name, e.g. "quiz_available". */
    public String wireName() {
        return name().toLowerCase();
    }
}
