package com.ai.studyengine.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared HTTP plumbing for JSON chat-style backends.
 */
@Slf4j
public abstract class HttpGenerationBackend implements GenerationBackend {

    protected final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();

    /** Name used in log lines and error messages. */
    protected abstract String displayName();

    protected ObjectNode message(String role, String content) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("role", role);
        msg.put("content", content);
        return msg;
    }

    protected ArrayNode messages(ObjectNode... items) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ObjectNode item : items) {
            array.add(item);
        }
        return array;
    }

    /**
     * POSTs {@code body} and returns the parsed JSON response.
     *
     * @throws IOException if the call fails or the status is not 200
     */
    protected JsonNode postJson(String url, Map<String, String> headers, ObjectNode body, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
        headers.forEach(builder::header);

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        log.debug("{} response status: {}", displayName(), response.statusCode());

        if (response.statusCode() != 200) {
            throw new IOException(displayName() + " API error [" + response.statusCode() + "]: " + response.body());
        }
        return objectMapper.readTree(response.body());
    }
}
