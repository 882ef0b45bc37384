package com.ai.studyengine.dto;

import com.ai.studyengine.model.Question;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuestionResponse {

    private String id;
    private String question;
    private List<String> options;

    /** 0-based index into options. */
    private int correctAnswer;

    private String explanation;
    private String sourceText;
    private Integer sourcePage;

    public static QuestionResponse from(Question question) {
        return QuestionResponse.builder()
                .id(question.getId())
                .question(question.getText())
                .options(question.getOptions())
                .correctAnswer(question.getCorrectAnswer())
                .explanation(question.getExplanation())
                .sourceText(question.getSourceText())
                .sourcePage(question.getSourcePage())
                .build();
    }
}
