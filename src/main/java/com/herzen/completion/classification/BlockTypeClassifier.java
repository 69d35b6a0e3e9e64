package com.herzen.completion.classification;

import com.herzen.completion.config.AggregatorProperties;
import com.herzen.completion.domain.ContentModels.CompletionMode;
import com.herzen.completion.domain.ContentModels.ContentNode;
import com.herzen.completion.exception.UnknownBlockTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Component
public class BlockTypeClassifier {
    private static final Logger log = LoggerFactory.getLogger(BlockTypeClassifier.class);

    private final Map<String, CompletionMode> registry;
    private final FallbackMode fallbackMode;

    @Autowired
    public BlockTypeClassifier(AggregatorProperties properties) {
        this(properties.getBlockTypes(), properties.getFallbackMode());
    }

    public BlockTypeClassifier(Map<String, CompletionMode> registry, FallbackMode fallbackMode) {
        this.fallbackMode = fallbackMode == null ? FallbackMode.NONE : fallbackMode;
        this.registry = Map.copyOf(validate(registry, this.fallbackMode));
        log.info("Block type registry loaded with {} types, fallback {}", this.registry.size(), this.fallbackMode);
    }

    public CompletionMode classify(String blockType) {
        return lookup(blockType, false);
    }

    public CompletionMode classify(ContentNode node) {
        return lookup(node.blockType(), !node.isLeaf());
    }

    public boolean isRegistered(String blockType) {
        return blockType != null && registry.containsKey(blockType);
    }

    private CompletionMode lookup(String blockType, boolean hasChildren) {
        CompletionMode mode = blockType == null ? null : registry.get(blockType);
        if (mode != null) return mode;

        CompletionMode fallback = fallbackMode.resolve(hasChildren);
        if (fallback == null) {
            throw new UnknownBlockTypeException(blockType);
        }
        return fallback;
    }

    private static Map<String, CompletionMode> validate(Map<String, CompletionMode> registry, FallbackMode fallbackMode) {
        Map<String, CompletionMode> checked = new LinkedHashMap<>();
        if (registry != null) {
            registry.forEach((type, mode) -> {
                if (type == null || type.isBlank()) {
                    throw new IllegalStateException("Block type registry contains a blank type token");
                }
                checked.put(type.trim(), Objects.requireNonNull(mode, "Completion mode missing for block type " + type));
            });
        }
        if (checked.isEmpty() && fallbackMode == FallbackMode.NONE) {
            throw new IllegalStateException("Block type registry is empty and no fallback mode is configured");
        }
        return checked;
    }
}
