package com.ai.studyengine.service.generation;

/**
 * Which part of a session's life a generation request belongs to.
 * Drives backend selection.
 */
public enum GenerationPhase {

    /** Topic hierarchy and the first visible batch of a new session. */
    INITIAL,

    /** Every later "generate more" batch. */
    INCREMENTAL
}
