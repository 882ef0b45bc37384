package com.ai.studyengine.service.generation;

/**
 * Backend output that could not be parsed or does not match the expected
 * shape. Always retryable.
 */
public class SchemaViolationException extends Exception {

    public SchemaViolationException(String message) {
        super(message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
