package com.herzen.completion.batch;

import com.herzen.completion.batch.BatchModels.BatchRunReport;
import com.herzen.completion.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "completion.aggregator.batch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final BatchCoordinator coordinator;
    private final AggregatorProperties properties;

    public BatchScheduler(BatchCoordinator coordinator, AggregatorProperties properties) {
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${completion.aggregator.batch.fixed-delay-ms:60000}")
    public void scheduledAggregation() {
        AggregatorProperties.Batch batch = properties.getBatch();
        try {
            BatchRunReport report = coordinator.drain(batch.getBatchSize(), batch.getClaimTtl(), batch.getMaxBatchesPerRun());
            if (report.claimed() > 0) {
                log.info("Scheduled aggregation processed {} units ({} failed)", report.processed(), report.failed());
            }
        } catch (Exception e) {
            // Keep the scheduling thread alive; unresolved records are retried on the next run.
            log.error("Scheduled aggregation failed", e);
        }
    }
}
