package com.herzen.completion.exception;

public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message) {
        super(message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceFailureException(String userId, String courseId, Throwable cause) {
        super(String.format("Failed to persist aggregates for %s in %s", userId, courseId), cause);
    }
}
