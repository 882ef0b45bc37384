package com.ai.studyengine.service.workflow;

/**
 * How leaves without prerequisites are unlocked after a topic completes.
 * In both policies a session starts with only its first leaf open, and a
 * leaf with prerequisites opens as soon as all of them are completed.
 */
public enum UnlockPolicy {

    /** Each completion opens the earliest locked leaf without prerequisites. */
    SEQUENTIAL,

    /** Each completion opens every locked leaf without prerequisites. */
    OPEN
}
