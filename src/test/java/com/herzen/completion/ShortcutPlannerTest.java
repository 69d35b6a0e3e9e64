package com.herzen.completion;

import com.herzen.completion.aggregation.AggregationModels.AggregateResult;
import com.herzen.completion.aggregation.ShortcutPlanner;
import com.herzen.completion.domain.ContentTree;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ShortcutPlannerTest {
    private final ShortcutPlanner planner = new ShortcutPlanner();
    private final ContentTree tree = TreeBuilder.sampleCourse("course-1");

    @Test
    void reusesStoredResultsOffTheChangedPath() {
        Map<String, AggregateResult> plan = planner.plan(tree, "video-1", false, storedForEveryBlock());

        assertEquals(Set.of("chapter-1", "html-1", "html-2", "video-2", "problem-1", "discussion-1"), plan.keySet());
        assertEquals(0.5, plan.get("chapter-1").earned());
    }

    @Test
    void neverShortcutsTheChangedBlockOrItsAncestors() {
        Map<String, AggregateResult> plan = planner.plan(tree, "seq-1", false, storedForEveryBlock());

        for (String onPath : tree.pathToRoot("seq-1")) {
            assertFalse(plan.containsKey(onPath), onPath);
        }
        assertTrue(plan.containsKey("chapter-1"));
        assertFalse(plan.containsKey("video-1"));
    }

    @Test
    void forcedRecomputationGetsNoShortcuts() {
        assertTrue(planner.plan(tree, "video-1", true, storedForEveryBlock()).isEmpty());
    }

    @Test
    void wholeCourseScopeGetsNoShortcuts() {
        assertTrue(planner.plan(tree, null, false, storedForEveryBlock()).isEmpty());
    }

    @Test
    void scopeBlockMissingFromTreeGetsNoShortcuts() {
        assertTrue(planner.plan(tree, "removed-block", false, storedForEveryBlock()).isEmpty());
    }

    @Test
    void storedResultsOfRemovedBlocksAreIgnored() {
        Map<String, AggregateResult> stored = storedForEveryBlock();
        stored.put("old-chapter", new AggregateResult("old-chapter", 1.0, 1.0));

        Map<String, AggregateResult> plan = planner.plan(tree, "html-1", false, stored);

        assertFalse(plan.containsKey("old-chapter"));
        assertTrue(plan.containsKey("chapter-2"));
        assertTrue(planner.plan(tree, "html-1", false, Map.of()).isEmpty());
    }

    private Map<String, AggregateResult> storedForEveryBlock() {
        Map<String, AggregateResult> stored = new HashMap<>();
        for (String blockId : tree.blockIds()) {
            stored.put(blockId, new AggregateResult(blockId, 0.5, 1.0));
        }
        return stored;
    }
}
