package com.herzen.completion.aggregation;

import com.herzen.completion.aggregation.AggregationModels.AggregateResult;
import com.herzen.completion.domain.ContentTree;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Component
public class ShortcutPlanner {

    public Map<String, AggregateResult> plan(ContentTree tree,
                                             String scopeBlock,
                                             boolean force,
                                             Map<String, AggregateResult> storedByBlock) {
        if (force || scopeBlock == null || storedByBlock == null || storedByBlock.isEmpty()) return Map.of();
        // Changed block no longer in the course: the structure moved, recompute everything.
        if (!tree.contains(scopeBlock)) return Map.of();

        Set<String> affected = new HashSet<>(tree.pathToRoot(scopeBlock));
        Map<String, AggregateResult> shortcuts = new HashMap<>();
        storedByBlock.forEach((blockId, stored) -> {
            if (tree.contains(blockId) && !affected.contains(blockId)) {
                shortcuts.put(blockId, stored);
            }
        });
        return shortcuts;
    }
}
