package com.ai.studyengine.exception;

/**
 * The requested learner action does not fit the topic's current workflow
 * stage (e.g. submitting a quiz on a locked topic).
 */
public class WorkflowTransitionException extends RuntimeException {

    public WorkflowTransitionException(String message) {
        super(message);
    }
}
