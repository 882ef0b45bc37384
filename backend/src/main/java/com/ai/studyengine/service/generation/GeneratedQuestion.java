package com.ai.studyengine.service.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A validated multiple-choice question as produced by a backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedQuestion {

    private String question;
    private List<String> options;
    private int correctAnswer;
    private String explanation;
    private String sourceText;
    private Integer sourcePage;
}
