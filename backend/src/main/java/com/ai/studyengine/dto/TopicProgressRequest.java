package com.ai.studyengine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Learner progress on a topic as reported by the client. Every field is
 * optional; only the ones present are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicProgressRequest {

    /** Required in batch updates, ignored on the single-topic endpoint. */
    private String topicId;

    @Min(value = 0, message = "score must be between 0 and 100")
    @Max(value = 100, message = "score must be between 0 and 100")
    private Integer score;

    @Min(value = 0, message = "currentQuestionIndex must not be negative")
    private Integer currentQuestionIndex;

    /** True once the learner finished the topic's quiz. */
    private Boolean completed;
}
