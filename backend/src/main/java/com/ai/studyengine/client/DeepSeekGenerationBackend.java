package com.ai.studyengine.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * DeepSeek chat completions (OpenAI-compatible). The bulk backend.
 * It cannot continue a seeded reply, so callers rely on format
 * instructions and validation instead.
 */
@Component
public class DeepSeekGenerationBackend extends HttpGenerationBackend {

    private static final String SYSTEM_PROMPT =
            "You are an expert educational content author. You reply with a single JSON object and nothing else.";

    @Value("${deepseek.api.key:}")
    private String apiKey;

    @Value("${deepseek.api.url:https://api.deepseek.com/chat/completions}")
    private String apiUrl;

    @Value("${deepseek.model:deepseek-chat}")
    private String model;

    @Value("${deepseek.timeout-seconds:180}")
    private long timeoutSeconds;

    @Override
    public BackendKind kind() {
        return BackendKind.BULK;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public boolean supportsPrefill() {
        return false;
    }

    @Override
    protected String displayName() {
        return "DeepSeek";
    }

    @Override
    public BackendReply complete(String prompt, String prefill, int maxTokens)
            throws IOException, InterruptedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", 0.7);
        body.set("messages", messages(message("system", SYSTEM_PROMPT), message("user", prompt)));

        JsonNode root = postJson(apiUrl, Map.of("Authorization", "Bearer " + apiKey),
                body, Duration.ofSeconds(timeoutSeconds));

        return BackendReply.builder()
                .text(root.at("/choices/0/message/content").asText(""))
                .truncated("length".equals(root.at("/choices/0/finish_reason").asText()))
                .inputTokens(root.at("/usage/prompt_tokens").asInt())
                .outputTokens(root.at("/usage/completion_tokens").asInt())
                .build();
    }
}
