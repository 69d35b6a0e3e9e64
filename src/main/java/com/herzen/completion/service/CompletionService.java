package com.herzen.completion.service;

import com.herzen.completion.aggregation.AggregationModels.AggregateResult;
import com.herzen.completion.aggregation.AggregationModels.TreeAggregation;
import com.herzen.completion.aggregation.ShortcutPlanner;
import com.herzen.completion.aggregation.TreeAggregator;
import com.herzen.completion.classification.BlockTypeClassifier;
import com.herzen.completion.config.AggregatorProperties;
import com.herzen.completion.domain.ContentTree;
import com.herzen.completion.exception.BlockNotFoundException;
import com.herzen.completion.repository.AggregatorJdbcRepository;
import com.herzen.completion.repository.AggregatorJdbcRepository.StoredAggregate;
import com.herzen.completion.service.CompletionModels.CompletionStatus;
import com.herzen.completion.service.CompletionModels.CompletionView;
import com.herzen.completion.source.CompletionSource;
import com.herzen.completion.staleness.StalenessModels.Scope;
import com.herzen.completion.staleness.StalenessModels.StaleRecord;
import com.herzen.completion.staleness.StalenessTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class CompletionService {
    private static final Logger log = LoggerFactory.getLogger(CompletionService.class);

    private final ContentTreeCache treeCache;
    private final CompletionSource completionSource;
    private final AggregatorJdbcRepository aggregatorRepository;
    private final StalenessTracker stalenessTracker;
    private final TreeAggregator treeAggregator;
    private final ShortcutPlanner shortcutPlanner;
    private final BlockTypeClassifier classifier;
    private final AggregatorProperties properties;
    private final Clock clock;

    public CompletionService(ContentTreeCache treeCache,
                             CompletionSource completionSource,
                             AggregatorJdbcRepository aggregatorRepository,
                             StalenessTracker stalenessTracker,
                             TreeAggregator treeAggregator,
                             ShortcutPlanner shortcutPlanner,
                             BlockTypeClassifier classifier,
                             AggregatorProperties properties,
                             Clock clock) {
        this.treeCache = treeCache;
        this.completionSource = completionSource;
        this.aggregatorRepository = aggregatorRepository;
        this.stalenessTracker = stalenessTracker;
        this.treeAggregator = treeAggregator;
        this.shortcutPlanner = shortcutPlanner;
        this.classifier = classifier;
        this.properties = properties;
        this.clock = clock;
    }

    public CompletionView getCourseCompletion(String userId, String courseId) {
        ContentTree tree = treeCache.get(courseId);
        return blockView(tree, userId, tree.rootId());
    }

    public CompletionView getBlockCompletion(String userId, String courseId, String blockId) {
        ContentTree tree = treeCache.get(courseId);
        if (!tree.contains(blockId)) {
            throw new BlockNotFoundException(courseId, blockId);
        }
        return blockView(tree, userId, blockId);
    }

    public List<CompletionView> getCourseCompletions(String courseId, Collection<String> userIds) {
        ContentTree tree = treeCache.get(courseId);
        Map<String, StoredAggregate> stored = aggregatorRepository.findForCourse(courseId, tree.rootId(), userIds).stream()
                .collect(Collectors.toMap(StoredAggregate::userId, Function.identity(), (a, b) -> b, LinkedHashMap::new));

        Collection<String> users = (userIds == null || userIds.isEmpty()) ? stored.keySet() : userIds;
        List<CompletionView> views = new ArrayList<>();
        for (String userId : users) {
            StoredAggregate row = stored.get(userId);
            if (row == null) {
                views.add(noData(userId, courseId, tree.rootId()));
            } else {
                views.add(toView(row, stalenessTracker.isStale(userId, courseId) ? CompletionStatus.STALE : CompletionStatus.CURRENT));
            }
        }
        return views;
    }

    public double meanCourseCompletion(String courseId) {
        ContentTree tree = treeCache.get(courseId);
        return aggregatorRepository.findForCourse(courseId, tree.rootId(), null).stream()
                .mapToDouble(row -> row.toResult().ratio())
                .average()
                .orElse(0.0);
    }

    // returns the number of stale records created
    public int triggerReaggregation(String courseId, Collection<String> userIds) {
        Set<String> users = new TreeSet<>();
        if (userIds == null || userIds.isEmpty()) {
            users.addAll(completionSource.usersWithCompletions(courseId));
            users.addAll(aggregatorRepository.usersInCourse(courseId));
        } else {
            users.addAll(userIds);
        }
        treeCache.invalidate(courseId);

        int created = 0;
        for (String userId : users) {
            if (stalenessTracker.markStale(userId, courseId, null, true)) created++;
        }
        log.info("Reaggregation requested for {}: {} users marked, {} new stale records", courseId, users.size(), created);
        return created;
    }

    private CompletionView blockView(ContentTree tree, String userId, String blockId) {
        String courseId = tree.courseId();
        List<StaleRecord> pending = stalenessTracker.findPending(userId, courseId);
        if (!pending.isEmpty() && !properties.isAsyncAggregation()) {
            return computeInline(tree, userId, blockId, Scope.merge(pending));
        }

        Optional<StoredAggregate> stored = aggregatorRepository.find(userId, courseId, blockId);
        if (stored.isEmpty()) {
            return noData(userId, courseId, blockId);
        }
        return toView(stored.get(), pending.isEmpty() ? CompletionStatus.CURRENT : CompletionStatus.STALE);
    }

    private CompletionView computeInline(ContentTree tree, String userId, String blockId, Scope scope) {
        String courseId = tree.courseId();
        Map<String, Double> leaves = completionSource.getLeafValues(userId, courseId, null);
        Map<String, AggregateResult> shortcuts = shortcutPlanner.plan(tree, scope.blockKey(), scope.force(),
                scope.force() || scope.wholeCourse() ? Map.of() : aggregatorRepository.resultsForUser(userId, courseId));

        TreeAggregation aggregation = treeAggregator.aggregate(tree, blockId, leaves, classifier, shortcuts);
        AggregateResult result = aggregation.root();
        log.debug("Computed {} for {} in {} inline: {}/{} ({} shortcuts)",
                blockId, userId, courseId, result.earned(), result.possible(), aggregation.shortcutHits().size());
        return new CompletionView(userId, courseId, blockId, result.earned(), result.possible(), result.ratio(),
                CompletionStatus.COMPUTED, clock.instant());
    }

    private CompletionView toView(StoredAggregate row, CompletionStatus status) {
        AggregateResult result = row.toResult();
        return new CompletionView(row.userId(), row.courseId(), row.blockKey(), result.earned(), result.possible(),
                result.ratio(), status, row.modified());
    }

    private CompletionView noData(String userId, String courseId, String blockId) {
        return new CompletionView(userId, courseId, blockId, 0.0, 0.0, 0.0, CompletionStatus.NO_DATA, null);
    }
}
