package com.ai.studyengine.dto;

import com.ai.studyengine.model.Flashcard;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A flashcard with its scheduling state and derived review flags.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlashcardResponse {

    private String id;
    private String topicId;
    private String front;
    private String back;
    private String hint;

    private double easeFactor;
    private int intervalDays;
    private int repetitions;
    private LocalDateTime nextReviewDate;
    private LocalDateTime lastReviewedAt;
    private int totalReviews;
    private int correctReviews;

    /** Percentage of correct reviews, rounded to one decimal. */
    private double accuracy;

    /** Derived at read time, never stored. */
    private boolean due;

    private boolean reviewedInCurrentPass;

    public static FlashcardResponse from(Flashcard card, LocalDateTime now) {
        return FlashcardResponse.builder()
                .id(card.getId())
                .topicId(card.getTopic().getId())
                .front(card.getFront())
                .back(card.getBack())
                .hint(card.getHint())
                .easeFactor(card.getEaseFactor())
                .intervalDays(card.getIntervalDays())
                .repetitions(card.getRepetitions())
                .nextReviewDate(card.getNextReviewDate())
                .lastReviewedAt(card.getLastReviewedAt())
                .totalReviews(card.getTotalReviews())
                .correctReviews(card.getCorrectReviews())
                .accuracy(Math.round(card.accuracy() * 10) / 10.0)
                .due(card.isDue(now))
                .reviewedInCurrentPass(card.isReviewedInCurrentPass())
                .build();
    }
}
