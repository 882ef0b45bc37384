package com.ai.studyengine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Validates a parsed backend reply and maps it to a typed result.
 *
 * @param <T> result type
 */
public interface ResponseSchema<T> {

    /** Short name for log lines. */
    String name();

    T validate(JsonNode root) throws SchemaViolationException;
}
