package com.ai.studyengine.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A flashcard of a leaf topic plus its SM-2 scheduling state.
 * Scheduling fields are only written by the spaced-repetition scheduler.
 */
@Entity
@Table(name = "flashcards", indexes = {
        @Index(name = "idx_flashcards_topic", columnList = "topic_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Flashcard {

    public static final double DEFAULT_EASE_FACTOR = 2.5;
    public static final double MIN_EASE_FACTOR = 1.3;

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "topic_id", nullable = false)
    private Topic topic;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String front;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String back;

    @Column(columnDefinition = "TEXT")
    private String hint;

    @Column(name = "ease_factor", nullable = false)
    @Builder.Default
    private double easeFactor = DEFAULT_EASE_FACTOR;

    @Column(name = "interval_days", nullable = false)
    @Builder.Default
    private int intervalDays = 1;

    @Column(nullable = false)
    private int repetitions;

    @Column(name = "next_review_date")
    private LocalDateTime nextReviewDate;

    @Column(name = "last_reviewed_at")
    private LocalDateTime lastReviewedAt;

    @Column(name = "total_reviews", nullable = false)
    private int totalReviews;

    @Column(name = "correct_reviews", nullable = false)
    private int correctReviews;

    /** Set once the card is reviewed while its topic is in flashcard review. */
    @Column(name = "reviewed_in_current_pass", nullable = false)
    private boolean reviewedInCurrentPass;

    /** A card that was never reviewed is always due. */
    public boolean isDue(LocalDateTime now) {
        return nextReviewDate == null || !nextReviewDate.isAfter(now);
    }

    /** Percentage of correct reviews, 0 when never reviewed. */
    public double accuracy() {
        if (totalReviews == 0)
            return 0.0;
        return (correctReviews * 100.0) / totalReviews;
    }
}
