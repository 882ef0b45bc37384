package com.ai.studyengine.client;

/**
 * The two interchangeable generation backends.
 * FAST answers quickly at a higher price; BULK is cheaper and used for
 * content that is not on screen yet.
 */
public enum BackendKind {
    FAST,
    BULK;

    public BackendKind other() {
        return this == FAST ? BULK : FAST;
    }
}
