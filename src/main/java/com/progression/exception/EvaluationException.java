package com.progression.exception;

/**
 * Exception raised while evaluating a single condition, trigger or score.
 * Always caught at the boundary of the unit that raised it.
 */
public class EvaluationException extends ProgressionException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
