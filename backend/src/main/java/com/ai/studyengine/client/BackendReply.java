package com.ai.studyengine.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw completion returned by a generation backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendReply {

    /** Generated text, without any prefill that was sent with the request. */
    private String text;

    /** True when the backend stopped because it hit the token limit. */
    private boolean truncated;

    private int inputTokens;
    private int outputTokens;
}
