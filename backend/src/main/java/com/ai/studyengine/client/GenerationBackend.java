package com.ai.studyengine.client;

import java.io.IOException;

/**
 * A text generation backend reachable over HTTP.
 * Implementations are selected by {@link BackendKind}, never by name.
 */
public interface GenerationBackend {

    BackendKind kind();

    /** False when no API key is configured; such a backend is never called. */
    boolean isConfigured();

    /**
     * Whether the backend can continue a partially written assistant reply.
     * Backends that can are seeded with the opening brace of the expected JSON.
     */
    boolean supportsPrefill();

    /**
     * Sends a single-turn prompt.
     *
     * @param prompt    user prompt
     * @param prefill   text the reply must continue from, or null
     * @param maxTokens upper bound on generated tokens
     * @throws IOException on transport errors and non-200 responses
     */
    BackendReply complete(String prompt, String prefill, int maxTokens) throws IOException, InterruptedException;
}
