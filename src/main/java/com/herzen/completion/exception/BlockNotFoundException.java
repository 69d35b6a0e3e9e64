package com.herzen.completion.exception;

public class BlockNotFoundException extends RuntimeException {

    public BlockNotFoundException(String message) {
        super(message);
    }

    public BlockNotFoundException(String courseId, String blockId) {
        super(String.format("Block %s not found in course %s", blockId, courseId));
    }
}
