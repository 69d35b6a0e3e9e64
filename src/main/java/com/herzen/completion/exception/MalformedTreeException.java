package com.herzen.completion.exception;

public class MalformedTreeException extends RuntimeException {

    public MalformedTreeException(String message) {
        super(message);
    }

    public MalformedTreeException(String courseId, String message) {
        super(String.format("Malformed content tree for course %s: %s", courseId, message));
    }
}
