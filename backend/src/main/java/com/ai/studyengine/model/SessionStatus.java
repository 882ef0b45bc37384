package com.ai.studyengine.model;

public enum SessionStatus {
    IN_PROGRESS,
    ARCHIVED
}
