package com.herzen.completion.domain;

import java.util.List;

public class ContentModels {
    public record ContentNode(String id, String blockType, List<String> children, String parentId) {
        public ContentNode {
            children = children == null ? List.of() : List.copyOf(children);
        }

        public boolean isLeaf() {
            return children.isEmpty();
        }
    }

    public enum CompletionMode { COMPLETABLE, EXCLUDED, AGGREGATOR }
}
