package com.ai.studyengine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for creating a study session from raw text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    @NotBlank(message = "content is required")
    @Size(min = 50, message = "content must contain at least 50 characters")
    private String content;

    /** Optional; the generated title is used when absent. */
    @Size(max = 255, message = "title must be at most 255 characters")
    private String title;

    /** Target number of leaf topics. */
    @Min(value = 1, message = "topicCount must be at least 1")
    @Max(value = 35, message = "topicCount must be at most 35")
    @Builder.Default
    private int topicCount = 6;

    @Min(value = 1, message = "questionsPerTopic must be at least 1")
    @Max(value = 100, message = "questionsPerTopic must be at most 100")
    @Builder.Default
    private int questionsPerTopic = 20;

    /** When true only the first few leaves are filled at creation. */
    @Builder.Default
    private boolean progressiveLoad = true;
}
