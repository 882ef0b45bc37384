package com.ai.studyengine.exception;

/**
 * Raised when no generation backend produced a usable, schema-valid
 * response within the retry budget. The affected batch is left untouched
 * and the caller may retry later.
 */
public class GenerationException extends RuntimeException {

    private final int attempts;

    public GenerationException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public GenerationException(String message) {
        this(message, 0, null);
    }

    /** Number of backend calls made before giving up. */
    public int getAttempts() {
        return attempts;
    }
}
