package com.ai.studyengine.service.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A prompt plus the number of items (topics or leaves) it asks for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationPrompt {

    private String text;

    private int batchSize;

    /** Token ceiling for the reply; 0 means the configured default. */
    private int maxTokens;
}
