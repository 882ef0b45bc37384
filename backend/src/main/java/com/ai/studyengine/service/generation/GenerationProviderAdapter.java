package com.ai.studyengine.service.generation;

import com.ai.studyengine.client.BackendReply;
import com.ai.studyengine.client.GenerationBackend;
import com.ai.studyengine.exception.GenerationException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Single entry point for structured generation. Runs the attempt plan of
 * {@link BackendSelectionPolicy}: seeds backends that support it with an
 * opening brace, repairs the reply into JSON, validates it against the
 * schema, and moves to the next attempt on any failure.
 */
@Slf4j
@Service
public class GenerationProviderAdapter {

    static final String STRICT_FORMAT_RULES = """

            FORMAT RULES (your previous reply could not be used):
            - Reply with ONE JSON object and nothing else.
            - Your first character must be { and your last character must be }.
            - No markdown, no code fences, no comments, no trailing commas.
            - Follow the field names of the requested format exactly.
            """;

    private final BackendSelectionPolicy selectionPolicy;
    private final JsonResponseRepair jsonResponseRepair;
    private final int defaultMaxTokens;

    public GenerationProviderAdapter(BackendSelectionPolicy selectionPolicy,
                                     JsonResponseRepair jsonResponseRepair,
                                     @Value("${generation.max-tokens:8192}") int defaultMaxTokens) {
        this.selectionPolicy = selectionPolicy;
        this.jsonResponseRepair = jsonResponseRepair;
        this.defaultMaxTokens = defaultMaxTokens;
    }

    /**
     * @throws GenerationException when every attempt of the plan failed
     */
    public <T> T generate(GenerationPrompt prompt, GenerationPhase phase, ResponseSchema<T> schema) {
        List<BackendAttempt> plan = selectionPolicy.plan(phase);
        if (plan.isEmpty()) {
            throw new GenerationException("No generation backend is configured. "
                    + "Set claude.api.key or deepseek.api.key.");
        }

        int maxTokens = prompt.getMaxTokens() > 0 ? prompt.getMaxTokens() : defaultMaxTokens;
        Exception lastFailure = null;
        int attempts = 0;

        for (BackendAttempt attempt : plan) {
            attempts++;
            GenerationBackend backend = attempt.getBackend();
            boolean prefill = backend.supportsPrefill();
            String text = attempt.isStrict() ? prompt.getText() + STRICT_FORMAT_RULES : prompt.getText();
            long startTime = System.currentTimeMillis();

            try {
                BackendReply reply = backend.complete(text, prefill ? JsonResponseRepair.PREFILL : null, maxTokens);
                if (reply.isTruncated()) {
                    throw new SchemaViolationException("Reply truncated at " + maxTokens + " tokens");
                }
                JsonNode root = jsonResponseRepair.parse(reply.getText(), prefill);
                T result = schema.validate(root);

                log.info("{} generated by {} backend (phase={}, batch={}, attempt={}, outputTokens={}, elapsed={}ms)",
                        schema.name(), backend.kind(), phase, prompt.getBatchSize(), attempts,
                        reply.getOutputTokens(), System.currentTimeMillis() - startTime);
                return result;

            } catch (SchemaViolationException | IOException e) {
                lastFailure = e;
                log.warn("{} attempt {}/{} on {} backend failed after {}ms: {}",
                        schema.name(), attempts, plan.size(), backend.kind(),
                        System.currentTimeMillis() - startTime, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenerationException("Generation interrupted", attempts, e);
            }
        }

        throw new GenerationException(schema.name() + " generation failed after " + attempts + " attempt(s): "
                + (lastFailure != null ? lastFailure.getMessage() : "unknown error"), attempts, lastFailure);
    }
}
