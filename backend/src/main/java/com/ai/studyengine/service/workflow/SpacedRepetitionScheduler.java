package com.ai.studyengine.service.workflow;

import com.ai.studyengine.model.Flashcard;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * SM-2 scheduling of a single flashcard.
 *
 * <pre>
 * quality &lt; 3 : repetitions = 0, interval = 1 day, ease factor unchanged
 * quality &gt;= 3: repetitions + 1,
 *                ease = max(1.3, ease + 0.1 - (5 - q) * (0.08 + (5 - q) * 0.02)),
 *                interval = 1, 6, then round(previous interval * ease)
 * </pre>
 *
 * Every review also bumps the review counters and sets the next review date
 * to now plus the new interval.
 */
@Component
public class SpacedRepetitionScheduler {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 5;
    public static final int PASSING_QUALITY = 3;

    private final Clock clock;

    public SpacedRepetitionScheduler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Applies one review to {@code card} in place.
     *
     * @throws IllegalArgumentException if quality is outside 0..5; the card is left untouched
     */
    public void review(Flashcard card, int quality) {
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new IllegalArgumentException("Review quality must be between 0 and 5, got " + quality);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        int repetitions;
        int interval;
        double easeFactor = card.getEaseFactor();

        if (quality < PASSING_QUALITY) {
            repetitions = 0;
            interval = 1;
        } else {
            repetitions = card.getRepetitions() + 1;
            int lapse = MAX_QUALITY - quality;
            easeFactor = Math.max(Flashcard.MIN_EASE_FACTOR, easeFactor + (0.1 - lapse * (0.08 + lapse * 0.02)));
            if (repetitions == 1) {
                interval = 1;
            } else if (repetitions == 2) {
                interval = 6;
            } else {
                interval = (int) Math.round(card.getIntervalDays() * easeFactor);
            }
        }

        card.setRepetitions(repetitions);
        card.setIntervalDays(Math.max(1, interval));
        card.setEaseFactor(easeFactor);
        card.setNextReviewDate(now.plusDays(card.getIntervalDays()));
        card.setLastReviewedAt(now);
        card.setTotalReviews(card.getTotalReviews() + 1);
        if (quality >= PASSING_QUALITY)
            card.setCorrectReviews(card.getCorrectReviews() + 1);
    }
}
