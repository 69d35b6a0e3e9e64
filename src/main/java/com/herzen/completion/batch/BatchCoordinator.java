package com.herzen.completion.batch;

import com.herzen.completion.aggregation.AggregationModels.AggregateResult;
import com.herzen.completion.aggregation.AggregationModels.TreeAggregation;
import com.herzen.completion.aggregation.ShortcutPlanner;
import com.herzen.completion.aggregation.TreeAggregator;
import com.herzen.completion.batch.BatchModels.BatchRunReport;
import com.herzen.completion.batch.BatchModels.Unit;
import com.herzen.completion.classification.BlockTypeClassifier;
import com.herzen.completion.config.AggregatorProperties;
import com.herzen.completion.domain.ContentModels.ContentNode;
import com.herzen.completion.domain.ContentTree;
import com.herzen.completion.exception.ClaimConflictException;
import com.herzen.completion.exception.PersistenceFailureException;
import com.herzen.completion.repository.AggregatorJdbcRepository;
import com.herzen.completion.source.CompletionSource;
import com.herzen.completion.source.ContentTreeProvider;
import com.herzen.completion.staleness.StalenessModels.Scope;
import com.herzen.completion.staleness.StalenessModels.StaleRecord;
import com.herzen.completion.staleness.StalenessTracker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

// A failed pair stays claimed until its claim expires; records resolve only after their results are stored.
@Service
public class BatchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final StalenessTracker stalenessTracker;
    private final ContentTreeProvider treeProvider;
    private final CompletionSource completionSource;
    private final AggregatorJdbcRepository aggregatorRepository;
    private final TreeAggregator treeAggregator;
    private final ShortcutPlanner shortcutPlanner;
    private final BlockTypeClassifier classifier;
    private final AggregatorProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public BatchCoordinator(StalenessTracker stalenessTracker,
                            ContentTreeProvider treeProvider,
                            CompletionSource completionSource,
                            AggregatorJdbcRepository aggregatorRepository,
                            TreeAggregator treeAggregator,
                            ShortcutPlanner shortcutPlanner,
                            BlockTypeClassifier classifier,
                            AggregatorProperties properties,
                            ApplicationEventPublisher eventPublisher,
                            MeterRegistry meterRegistry,
                            Clock clock) {
        this.stalenessTracker = stalenessTracker;
        this.treeProvider = treeProvider;
        this.completionSource = completionSource;
        this.aggregatorRepository = aggregatorRepository;
        this.treeAggregator = treeAggregator;
        this.shortcutPlanner = shortcutPlanner;
        this.classifier = classifier;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public BatchRunReport runOnce(int batchSize, Duration claimTtl) {
        long started = System.nanoTime();
        try {
            return process(batchSize, claimTtl);
        } finally {
            meterRegistry.timer("completion.aggregator.batch.duration").record(Duration.ofNanos(System.nanoTime() - started));
        }
    }

    public BatchRunReport drain(int batchSize, Duration claimTtl, int maxBatches) {
        BatchRunReport total = BatchRunReport.empty();
        for (int i = 0; i < maxBatches; i++) {
            BatchRunReport report = runOnce(batchSize, claimTtl);
            total = total.plus(report);
            if (report.claimed() == 0) break;
        }
        return total;
    }

    private BatchRunReport process(int batchSize, Duration claimTtl) {
        Instant runStart = clock.instant();
        List<StaleRecord> claimed;
        try {
            claimed = stalenessTracker.claimBatch(batchSize, claimTtl);
        } catch (ClaimConflictException e) {
            log.debug("Batch claim lost to another worker: {}", e.getMessage());
            return BatchRunReport.empty();
        }
        if (claimed.isEmpty()) return BatchRunReport.empty();

        Map<String, Map<String, List<StaleRecord>>> byCourse = new LinkedHashMap<>();
        for (StaleRecord r : claimed) {
            byCourse.computeIfAbsent(r.courseId(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(r.userId(), k -> new ArrayList<>())
                    .add(r);
        }

        int processed = 0;
        int failed = 0;
        int resolved = 0;
        for (var course : byCourse.entrySet()) {
            String courseId = course.getKey();
            ContentTree tree;
            try {
                tree = treeProvider.getTree(courseId);
            } catch (RuntimeException e) {
                log.error("Could not load content tree for {}; leaving {} users for retry", courseId, course.getValue().size(), e);
                failed += course.getValue().size();
                continue;
            }

            for (var user : course.getValue().entrySet()) {
                Unit unit = Unit.of(user.getKey(), courseId, user.getValue());
                try {
                    resolved += processUnit(tree, unit, runStart);
                    processed++;
                } catch (RuntimeException e) {
                    log.error("Aggregation failed for {} in {}; leaving {} records for retry",
                            unit.userId(), courseId, unit.records().size(), e);
                    failed++;
                }
            }
        }

        meterRegistry.counter("completion.aggregator.batch.units", "outcome", "processed").increment(processed);
        meterRegistry.counter("completion.aggregator.batch.units", "outcome", "failed").increment(failed);
        BatchRunReport report = new BatchRunReport(claimed.size(), processed, failed, resolved);
        if (report.allFailed()) {
            meterRegistry.counter("completion.aggregator.batch.runs.failed").increment();
            log.error("Aggregation run failed for all {} units ({} records claimed)", failed, claimed.size());
        } else {
            log.info("Aggregation run finished: {} records claimed, {} units processed, {} failed, {} records resolved",
                    claimed.size(), processed, failed, resolved);
        }
        return report;
    }

    private int processUnit(ContentTree tree, Unit unit, Instant runStart) {
        Map<String, Double> leaves = completionSource.getLeafValues(unit.userId(), unit.courseId(), null);
        Scope scope = unit.scope();
        Map<String, AggregateResult> shortcuts = scope.force() || scope.wholeCourse()
                ? Map.of()
                : shortcutPlanner.plan(tree, scope.blockKey(), false, aggregatorRepository.resultsForUser(unit.userId(), unit.courseId()));

        TreeAggregation aggregation = treeAggregator.aggregate(tree, leaves, classifier, shortcuts);
        Instant modified = clock.instant();
        try {
            aggregatorRepository.upsertAll(unit.userId(), unit.courseId(), tree, aggregation.computed(), modified);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException(unit.userId(), unit.courseId(), e);
        }
        publishUpdates(tree, unit, aggregation.computed().values(), modified);
        log.debug("Aggregated {} in {}: {} blocks computed, {} shortcuts, course {}/{}",
                unit.userId(), unit.courseId(), aggregation.computed().size(), aggregation.shortcutHits().size(),
                aggregation.root().earned(), aggregation.root().possible());

        int resolved = stalenessTracker.resolve(unit.recordIds());
        if (scope.wholeCourse()) {
            resolved += stalenessTracker.resolveCovered(unit.userId(), unit.courseId(), runStart);
        }
        return resolved;
    }

    private void publishUpdates(ContentTree tree, Unit unit, Collection<AggregateResult> results, Instant modified) {
        Set<String> tracked = properties.getTrackingEventTypes();
        if (tracked == null || tracked.isEmpty()) return;
        for (AggregateResult result : results) {
            String blockType = tree.node(result.blockId()).map(ContentNode::blockType).orElse(null);
            if (blockType == null || !tracked.contains(blockType)) continue;
            try {
                eventPublisher.publishEvent(new AggregatorUpdatedEvent(unit.userId(), unit.courseId(), result.blockId(),
                        blockType, result.earned(), result.possible(), modified));
            } catch (RuntimeException e) {
                log.warn("Listener failed for aggregator update of {} ({}/{})", result.blockId(), unit.userId(), unit.courseId(), e);
            }
        }
    }
}
