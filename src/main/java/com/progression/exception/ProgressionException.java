package com.progression.exception;

/**
 * Base exception for the progression engine.
 */
public class ProgressionException extends RuntimeException {

    public ProgressionException(String message) {
        super(message);
    }

    public ProgressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
