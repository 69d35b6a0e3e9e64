package com.herzen.completion.aggregation;

import com.herzen.completion.aggregation.AggregationModels.AggregateResult;
import com.herzen.completion.aggregation.AggregationModels.TreeAggregation;
import com.herzen.completion.classification.BlockTypeClassifier;
import com.herzen.completion.domain.ContentModels.ContentNode;
import com.herzen.completion.domain.ContentTree;
import com.herzen.completion.exception.MalformedTreeException;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class TreeAggregator {

    public TreeAggregation aggregate(ContentTree tree,
                                     Map<String, Double> leafValues,
                                     BlockTypeClassifier classifier,
                                     Map<String, AggregateResult> shortcuts) {
        return aggregate(tree, tree.rootId(), leafValues, classifier, shortcuts);
    }

    public TreeAggregation aggregate(ContentTree tree,
                                     String startBlock,
                                     Map<String, Double> leafValues,
                                     BlockTypeClassifier classifier,
                                     Map<String, AggregateResult> shortcuts) {
        if (!tree.contains(startBlock)) {
            throw new MalformedTreeException(tree.courseId(), "start block " + startBlock + " is not in the tree");
        }
        Traversal traversal = new Traversal(tree,
                leafValues == null ? Map.of() : leafValues,
                classifier,
                shortcuts == null ? Map.of() : shortcuts);
        traversal.visit(startBlock);
        return new TreeAggregation(startBlock, traversal.results, traversal.shortcutHits);
    }

    static double clamp(Double value) {
        if (value == null || value.isNaN()) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static final class Traversal {
        private final ContentTree tree;
        private final Map<String, Double> leafValues;
        private final BlockTypeClassifier classifier;
        private final Map<String, AggregateResult> shortcuts;
        private final Set<String> visited = new HashSet<>();
        private final Map<String, AggregateResult> results = new LinkedHashMap<>();
        private final Set<String> shortcutHits = new HashSet<>();

        private Traversal(ContentTree tree,
                          Map<String, Double> leafValues,
                          BlockTypeClassifier classifier,
                          Map<String, AggregateResult> shortcuts) {
            this.tree = tree;
            this.leafValues = leafValues;
            this.classifier = classifier;
            this.shortcuts = shortcuts;
        }

        private AggregateResult visit(String blockId) {
            if (!visited.add(blockId)) {
                throw new MalformedTreeException(tree.courseId(), "block " + blockId + " is reachable twice (cycle or shared child)");
            }
            ContentNode node = tree.node(blockId)
                    .orElseThrow(() -> new MalformedTreeException(tree.courseId(), "dangling reference to block " + blockId));

            AggregateResult shortcut = shortcuts.get(blockId);
            if (shortcut != null) {
                shortcutHits.add(blockId);
                return record(new AggregateResult(blockId, shortcut.earned(), shortcut.possible()));
            }

            return switch (classifier.classify(node)) {
                case EXCLUDED -> record(AggregateResult.empty(blockId));
                case COMPLETABLE -> record(new AggregateResult(blockId, clamp(leafValues.get(blockId)), 1.0));
                case AGGREGATOR -> {
                    double earned = 0.0;
                    double possible = 0.0;
                    for (String child : node.children()) {
                        AggregateResult r = visit(child);
                        earned += r.earned();
                        possible += r.possible();
                    }
                    yield record(new AggregateResult(blockId, earned, possible));
                }
            };
        }

        private AggregateResult record(AggregateResult result) {
            results.put(result.blockId(), result);
            return result;
        }
    }
}
