package com.ai.studyengine.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw backend text into a JSON object. Handles replies that continue
 * a seeded opening brace, markdown fences, prose around the object and
 * trailing commas.
 */
@Slf4j
@Component
public class JsonResponseRepair {

    public static final String PREFILL = "{";

    private final ObjectReader reader;

    public JsonResponseRepair(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(JsonReadFeature.ALLOW_TRAILING_COMMA);
    }

    /**
     * @param raw       backend text
     * @param prefilled whether the request was seeded with {@link #PREFILL}
     * @throws SchemaViolationException when no JSON object can be recovered
     */
    public JsonNode parse(String raw, boolean prefilled) throws SchemaViolationException {
        if (raw == null || raw.isBlank()) {
            throw new SchemaViolationException("Empty response from backend");
        }

        String text = raw.strip();
        if (prefilled && !text.startsWith(PREFILL)) {
            text = PREFILL + text;
        }

        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new SchemaViolationException("No JSON object found in response");
        }
        if (start > 0 || end < text.length() - 1) {
            log.debug("Trimmed {} leading and {} trailing characters around JSON", start, text.length() - 1 - end);
        }

        try {
            JsonNode node = reader.readTree(text.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new SchemaViolationException("Response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }
}
