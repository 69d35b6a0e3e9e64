package com.herzen.completion.exception;

// every candidate went to another worker; retry next cycle
public class ClaimConflictException extends RuntimeException {

    public ClaimConflictException(String message) {
        super(message);
    }

    public ClaimConflictException(int candidates) {
        super(String.format("Lost all %d claim candidates to concurrent workers", candidates));
    }
}
