package com.herzen.completion.aggregation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class AggregationModels {
    // ratio is 1.0 when nothing is possible
    public record AggregateResult(String blockId, double earned, double possible) {
        public AggregateResult {
            if (earned < 0.0 || possible < 0.0 || Double.isNaN(earned) || Double.isNaN(possible)) {
                throw new IllegalArgumentException("Negative or NaN completion for block " + blockId + ": " + earned + "/" + possible);
            }
        }

        public double ratio() {
            return possible == 0.0 ? 1.0 : earned / possible;
        }

        public static AggregateResult empty(String blockId) {
            return new AggregateResult(blockId, 0.0, 0.0);
        }
    }

    public record TreeAggregation(String rootId, Map<String, AggregateResult> results, Set<String> shortcutHits) {
        public TreeAggregation {
            results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
            shortcutHits = Set.copyOf(shortcutHits);
        }

        public AggregateResult root() {
            return results.get(rootId);
        }

        public AggregateResult get(String blockId) {
            return results.get(blockId);
        }

        public Map<String, AggregateResult> computed() {
            Map<String, AggregateResult> out = new LinkedHashMap<>(results);
            out.keySet().removeAll(shortcutHits);
            return out;
        }
    }
}
