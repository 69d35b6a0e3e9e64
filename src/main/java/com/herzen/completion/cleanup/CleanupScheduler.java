package com.herzen.completion.cleanup;

import com.herzen.completion.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "completion.aggregator.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CleanupScheduler {
    private static final Logger log = LoggerFactory.getLogger(CleanupScheduler.class);

    private final CleanupSweeper sweeper;
    private final AggregatorProperties properties;

    public CleanupScheduler(CleanupSweeper sweeper, AggregatorProperties properties) {
        this.sweeper = sweeper;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${completion.aggregator.cleanup.fixed-delay-ms:900000}")
    public void scheduledCleanup() {
        try {
            int released = sweeper.releaseExpired();
            int swept = sweeper.sweep(properties.getCleanup().getRetention());
            int pruned = sweeper.pruneOrphans(properties.getCleanup().getAggregateRetention());
            log.debug("Cleanup finished: {} claims released, {} stale records deleted, {} aggregates pruned", released, swept, pruned);
        } catch (Exception e) {
            log.error("Scheduled cleanup failed", e);
        }
    }
}
