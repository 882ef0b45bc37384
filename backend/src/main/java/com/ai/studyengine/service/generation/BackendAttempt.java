package com.ai.studyengine.service.generation;

import com.ai.studyengine.client.GenerationBackend;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One step of a generation attempt plan.
 */
@Data
@AllArgsConstructor
public class BackendAttempt {

    private GenerationBackend backend;

    /** Repeat the format rules more forcefully, used on retries. */
    private boolean strict;
}
