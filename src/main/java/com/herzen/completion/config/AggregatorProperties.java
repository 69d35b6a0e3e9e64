package com.herzen.completion.config;

import com.herzen.completion.classification.FallbackMode;
import com.herzen.completion.domain.ContentModels.CompletionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "completion.aggregator")
public class AggregatorProperties {

    private boolean asyncAggregation = false;
    private Map<String, CompletionMode> blockTypes = new LinkedHashMap<>();
    private FallbackMode fallbackMode = FallbackMode.NONE;
    private Duration treeCacheTtl = Duration.ofMinutes(10);
    private Set<String> trackingEventTypes = new LinkedHashSet<>(List.of("course", "chapter", "sequential", "vertical"));
    private final Batch batch = new Batch();
    private final Cleanup cleanup = new Cleanup();

    public boolean isAsyncAggregation() {
        return asyncAggregation;
    }

    public void setAsyncAggregation(boolean asyncAggregation) {
        this.asyncAggregation = asyncAggregation;
    }

    public Map<String, CompletionMode> getBlockTypes() {
        return blockTypes;
    }

    public void setBlockTypes(Map<String, CompletionMode> blockTypes) {
        this.blockTypes = blockTypes;
    }

    public FallbackMode getFallbackMode() {
        return fallbackMode;
    }

    public void setFallbackMode(FallbackMode fallbackMode) {
        this.fallbackMode = fallbackMode;
    }

    public Duration getTreeCacheTtl() {
        return treeCacheTtl;
    }

    public void setTreeCacheTtl(Duration treeCacheTtl) {
        this.treeCacheTtl = treeCacheTtl;
    }

    public Set<String> getTrackingEventTypes() {
        return trackingEventTypes;
    }

    public void setTrackingEventTypes(Set<String> trackingEventTypes) {
        this.trackingEventTypes = trackingEventTypes;
    }

    public Batch getBatch() {
        return batch;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public static class Batch {
        private int batchSize = 1000;
        private int maxBatchesPerRun = 500;
        private Duration claimTtl = Duration.ofSeconds(1800);

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxBatchesPerRun() {
            return maxBatchesPerRun;
        }

        public void setMaxBatchesPerRun(int maxBatchesPerRun) {
            this.maxBatchesPerRun = maxBatchesPerRun;
        }

        public Duration getClaimTtl() {
            return claimTtl;
        }

        public void setClaimTtl(Duration claimTtl) {
            this.claimTtl = claimTtl;
        }
    }

    public static class Cleanup {
        private Duration retention = Duration.ofDays(7);
        private Duration aggregateRetention = Duration.ofDays(30);

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getAggregateRetention() {
            return aggregateRetention;
        }

        public void setAggregateRetention(Duration aggregateRetention) {
            this.aggregateRetention = aggregateRetention;
        }
    }
}
