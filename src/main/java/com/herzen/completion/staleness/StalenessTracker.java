package com.herzen.completion.staleness;

import com.herzen.completion.exception.ClaimConflictException;
import com.herzen.completion.exception.PersistenceFailureException;
import com.herzen.completion.repository.StaleCompletionJdbcRepository;
import com.herzen.completion.staleness.StalenessModels.StaleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

// One pending unclaimed record per (user, course); claiming detaches it so later marks start a new one.
@Service
public class StalenessTracker {
    private static final Logger log = LoggerFactory.getLogger(StalenessTracker.class);
    private static final int MARK_ATTEMPTS = 3;

    private final StaleCompletionJdbcRepository repository;
    private final Clock clock;

    public StalenessTracker(StaleCompletionJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public boolean markStale(String userId, String courseId, String scopeBlock) {
        return markStale(userId, courseId, scopeBlock, false);
    }

    // true if a new pending record was created
    public boolean markStale(String userId, String courseId, String scopeBlock, boolean force) {
        String openKey = openKey(userId, courseId);
        for (int attempt = 0; attempt < MARK_ATTEMPTS; attempt++) {
            long now = clock.millis();
            if (repository.widenOpen(openKey, scopeBlock, force, now) > 0) {
                log.debug("Folded mark for {}/{} (scope {}) into pending record", userId, courseId, scopeBlock);
                return false;
            }
            try {
                long id = repository.insertOpen(openKey, userId, courseId, scopeBlock, force, now);
                log.debug("Created stale record {} for {}/{} (scope {})", id, userId, courseId, scopeBlock);
                return true;
            } catch (DuplicateKeyException e) {
                log.debug("Concurrent mark for {}/{} won the insert, retrying", userId, courseId);
            }
        }
        throw new PersistenceFailureException("Could not record stale completion for " + userId + " in " + courseId);
    }

    /**
     * Claims up to {@code maxCount} unresolved records that are unclaimed or whose claim has expired. A pair
     * with a live claim under another token is never claimed, so each (user, course) pair has at most one
     * worker. Two claimers that race onto different records of one pair both re-check after claiming; the
     * later one, or both, release their rows.
     *
     * @throws ClaimConflictException if claimable records existed but all of them went to other workers
     */
    public List<StaleRecord> claimBatch(int maxCount, Duration claimTtl) {
        if (maxCount <= 0) return List.of();
        String token = UUID.randomUUID().toString();
        long now = clock.millis();
        List<Long> candidates = repository.findClaimableIds(token, now, maxCount);
        if (candidates.isEmpty()) return List.of();

        long expires = now + claimTtl.toMillis();
        int won = 0;
        for (Long id : candidates) {
            won += repository.tryClaim(id, token, expires, now);
        }
        if (won == 0) {
            throw new ClaimConflictException(candidates.size());
        }

        List<StaleRecord> claimed = new ArrayList<>();
        Map<String, List<StaleRecord>> byPair = new LinkedHashMap<>();
        for (StaleRecord r : repository.findByClaimToken(token)) {
            byPair.computeIfAbsent(openKey(r.userId(), r.courseId()), k -> new ArrayList<>()).add(r);
        }
        for (List<StaleRecord> pair : byPair.values()) {
            StaleRecord first = pair.get(0);
            if (repository.hasRivalClaim(first.userId(), first.courseId(), token, now)) {
                repository.releaseClaim(pair.stream().map(StaleRecord::id).toList(), token);
                log.debug("Released {} records of {}/{}: pair already claimed by another worker",
                        pair.size(), first.userId(), first.courseId());
            } else {
                claimed.addAll(pair);
            }
        }
        if (claimed.isEmpty()) {
            throw new ClaimConflictException(candidates.size());
        }
        log.debug("Claimed {} of {} stale records with token {}", claimed.size(), candidates.size(), token);
        return claimed;
    }

    public int resolve(Collection<Long> recordIds) {
        if (recordIds == null || recordIds.isEmpty()) return 0;
        return repository.resolve(new ArrayList<>(recordIds), clock.millis());
    }

    /**
     * Resolves unclaimed records of the pair last touched before {@code before}; a whole-course
     * recomputation that started at {@code before} already reflects them.
     */
    public int resolveCovered(String userId, String courseId, Instant before) {
        return repository.resolveUnclaimedBefore(userId, courseId, before.toEpochMilli(), clock.millis());
    }

    public int releaseExpired() {
        int released = repository.releaseExpired(clock.millis());
        if (released > 0) {
            log.info("Released {} expired stale record claims", released);
        }
        return released;
    }

    public List<StaleRecord> findPending(String userId, String courseId) {
        return repository.findPending(userId, courseId);
    }

    public boolean isStale(String userId, String courseId) {
        return !findPending(userId, courseId).isEmpty();
    }

    public Optional<StaleRecord> find(long recordId) {
        return repository.findById(recordId);
    }

    public long countPending() {
        return repository.countPending();
    }

    static String openKey(String userId, String courseId) {
        return userId + "|" + courseId;
    }
}
