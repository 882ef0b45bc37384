package com.ai.studyengine.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Anthropic Messages API. The fast backend; supports seeding the
 * assistant turn so the reply continues a JSON object.
 */
@Component
public class ClaudeGenerationBackend extends HttpGenerationBackend {

    @Value("${claude.api.key:}")
    private String apiKey;

    @Value("${claude.api.url:https://api.anthropic.com/v1/messages}")
    private String apiUrl;

    @Value("${claude.model:claude-3-5-haiku-20241022}")
    private String model;

    @Value("${claude.timeout-seconds:120}")
    private long timeoutSeconds;

    @Override
    public BackendKind kind() {
        return BackendKind.FAST;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public boolean supportsPrefill() {
        return true;
    }

    @Override
    protected String displayName() {
        return "Claude";
    }

    @Override
    public BackendReply complete(String prompt, String prefill, int maxTokens)
            throws IOException, InterruptedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", 0.7);
        if (prefill != null) {
            body.set("messages", messages(message("user", prompt), message("assistant", prefill)));
        } else {
            body.set("messages", messages(message("user", prompt)));
        }

        JsonNode root = postJson(apiUrl, Map.of(
                "x-api-key", apiKey,
                "anthropic-version", "2023-06-01"), body, Duration.ofSeconds(timeoutSeconds));

        return BackendReply.builder()
                .text(root.at("/content/0/text").asText(""))
                .truncated("max_tokens".equals(root.path("stop_reason").asText()))
                .inputTokens(root.at("/usage/input_tokens").asInt())
                .outputTokens(root.at("/usage/output_tokens").asInt())
                .build();
    }
}
