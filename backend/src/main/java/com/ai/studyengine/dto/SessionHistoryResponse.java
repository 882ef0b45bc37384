package com.ai.studyengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Lightweight DTO for the session history list.
 * Excludes the topic tree and source text to keep the payload small.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionHistoryResponse {

    private String id;
    private String title;
    private String status;
    private int progress;
    private int totalTopics;
    private int questionsRemaining;
    private boolean fromCache;
    private LocalDateTime createdAt;
}
