package com.herzen.completion.exception;

public class UnknownBlockTypeException extends RuntimeException {
    private final String blockType;

    public UnknownBlockTypeException(String blockType) {
        super(String.format("Block type '%s' has no completion mode and no fallback is configured", blockType));
        this.blockType = blockType;
    }

    public String getBlockType() {
        return blockType;
    }
}
