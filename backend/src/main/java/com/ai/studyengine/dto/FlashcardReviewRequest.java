package com.ai.studyengine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single flashcard review. Quality follows SM-2: 0 (blackout) to 5 (perfect recall).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlashcardReviewRequest {

    @NotNull(message = "quality is required")
    @Min(value = 0, message = "quality must be between 0 and 5")
    @Max(value = 5, message = "quality must be between 0 and 5")
    private Integer quality;
}
