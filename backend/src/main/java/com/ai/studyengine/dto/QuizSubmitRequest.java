package com.ai.studyengine.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Answers to a topic quiz: one selected option index (0-3) per question in
 * question order. Null or missing entries count as unanswered.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuizSubmitRequest {

    @NotNull(message = "answers are required")
    private List<Integer> answers;
}
