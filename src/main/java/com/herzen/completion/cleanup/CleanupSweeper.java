package com.herzen.completion.cleanup;

import com.herzen.completion.domain.ContentTree;
import com.herzen.completion.repository.AggregatorJdbcRepository;
import com.herzen.completion.repository.StaleCompletionJdbcRepository;
import com.herzen.completion.source.ContentTreeProvider;
import com.herzen.completion.staleness.StalenessTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class CleanupSweeper {
    private static final Logger log = LoggerFactory.getLogger(CleanupSweeper.class);

    private final StaleCompletionJdbcRepository staleRepository;
    private final StalenessTracker stalenessTracker;
    private final AggregatorJdbcRepository aggregatorRepository;
    private final ContentTreeProvider treeProvider;
    private final Clock clock;

    public CleanupSweeper(StaleCompletionJdbcRepository staleRepository,
                          StalenessTracker stalenessTracker,
                          AggregatorJdbcRepository aggregatorRepository,
                          ContentTreeProvider treeProvider,
                          Clock clock) {
        this.staleRepository = staleRepository;
        this.stalenessTracker = stalenessTracker;
        this.aggregatorRepository = aggregatorRepository;
        this.treeProvider = treeProvider;
        this.clock = clock;
    }

    public int sweep(Duration retentionHorizon) {
        Instant cutoff = clock.instant().minus(retentionHorizon);
        int deleted = staleRepository.deleteResolvedBefore(cutoff.toEpochMilli());
        log.debug("Deleted {} resolved stale records older than {}", deleted, cutoff);
        return deleted;
    }

    public int releaseExpired() {
        return stalenessTracker.releaseExpired();
    }

    public int pruneOrphans(Duration retentionHorizon) {
        Instant cutoff = clock.instant().minus(retentionHorizon);
        int deleted = 0;
        for (String courseId : aggregatorRepository.courseIds()) {
            ContentTree tree;
            try {
                tree = treeProvider.getTree(courseId);
            } catch (RuntimeException e) {
                log.warn("Skipping orphan pruning for {}: {}", courseId, e.getMessage());
                continue;
            }
            deleted += aggregatorRepository.deleteOrphans(courseId, tree.blockIds(), cutoff);
        }
        if (deleted > 0) {
            log.info("Pruned {} aggregates of removed blocks", deleted);
        }
        return deleted;
    }
}
