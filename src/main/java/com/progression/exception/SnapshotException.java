package com.progression.exception;

/**
 * Exception thrown when a character document cannot be turned into a snapshot.
 */
public class SnapshotException extends ProgressionException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
