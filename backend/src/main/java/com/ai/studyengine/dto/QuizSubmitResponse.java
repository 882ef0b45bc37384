package com.ai.studyengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Returned after the learner submits a topic quiz.
 * Contains per-question results, the overall score and the workflow effect.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuizSubmitResponse {

    private String topicId;

    /** Overall score (number of correct answers). */
    private int score;

    private int totalQuestions;

    /** Score as a percentage (0-100). */
    private int percentage;

    private boolean passed;

    /** A friendly grade label: "Excellent", "Good", "Needs Improvement", etc. */
    private String grade;

    /** Stage of the topic after grading. */
    private String workflowStage;

    private List<String> unlockedTopicIds;

    private int sessionProgress;

    /** Per-question breakdown. */
    private List<QuestionResult> results;

    /**
     * Result for a single question.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QuestionResult {

        /** 0-based index in the topic's question order. */
        private int index;

        private String question;

        /** Option index the learner selected, null when unanswered. */
        private Integer selectedAnswer;

        private int correctAnswer;

        private boolean correct;

        private String explanation;

        /** Passage of the source material that contains the answer. */
        private String sourceText;
    }
}
