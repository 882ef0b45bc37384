package com.ai.studyengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DueFlashcardsResponse {

    private String sessionId;
    private int dueCount;
    private List<FlashcardResponse> flashcards;
}
