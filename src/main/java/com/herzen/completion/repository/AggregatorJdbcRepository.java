package com.herzen.completion.repository;

import com.herzen.completion.aggregation.AggregationModels.AggregateResult;
import com.herzen.completion.domain.ContentModels.ContentNode;
import com.herzen.completion.domain.ContentTree;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Repository
public class AggregatorJdbcRepository {
    private static final String COLUMNS = "user_id, course_id, block_key, aggregation_name, earned, possible, modified";
    private static final RowMapper<StoredAggregate> MAPPER = (rs, n) -> new StoredAggregate(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
            rs.getDouble(5), rs.getDouble(6), Instant.ofEpochMilli(rs.getLong(7)));

    private final JdbcTemplate jdbcTemplate;

    public AggregatorJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public int upsertAll(String userId, String courseId, ContentTree tree, Map<String, AggregateResult> results, Instant modified) {
        if (results.isEmpty()) return 0;
        List<Object[]> rows = results.values().stream()
                .map(r -> new Object[]{
                        userId, courseId, r.blockId(),
                        tree.node(r.blockId()).map(ContentNode::blockType).orElse("unknown"),
                        r.earned(), r.possible(), modified.toEpochMilli()})
                .toList();
        jdbcTemplate.batchUpdate(
                "MERGE INTO aggregators(" + COLUMNS + ") KEY(user_id, course_id, block_key) VALUES (?,?,?,?,?,?,?)",
                rows);
        return rows.size();
    }

    public Optional<StoredAggregate> find(String userId, String courseId, String blockKey) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM aggregators WHERE user_id = ? AND course_id = ? AND block_key = ?",
                MAPPER, userId, courseId, blockKey).stream().findFirst();
    }

    public List<StoredAggregate> findForUser(String userId, String courseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM aggregators WHERE user_id = ? AND course_id = ?",
                MAPPER, userId, courseId);
    }

    public Map<String, AggregateResult> resultsForUser(String userId, String courseId) {
        return findForUser(userId, courseId).stream()
                .collect(Collectors.toMap(StoredAggregate::blockKey, StoredAggregate::toResult, (a, b) -> b, HashMap::new));
    }

    // empty or null userIds reads every user of the course
    public List<StoredAggregate> findForCourse(String courseId, String blockKey, Collection<String> userIds) {
        List<Object> args = new ArrayList<>(List.of(courseId, blockKey));
        String userFilter = "";
        if (userIds != null && !userIds.isEmpty()) {
            userFilter = " AND user_id IN (" + String.join(",", Collections.nCopies(userIds.size(), "?")) + ")";
            args.addAll(userIds);
        }
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM aggregators WHERE course_id = ? AND block_key = ?" + userFilter + " ORDER BY user_id",
                MAPPER, args.toArray());
    }

    public List<StoredAggregate> findByAggregationName(String userId, String courseId, String aggregationName) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM aggregators WHERE user_id = ? AND course_id = ? AND aggregation_name = ? ORDER BY block_key",
                MAPPER, userId, courseId, aggregationName);
    }

    public List<String> usersInCourse(String courseId) {
        return jdbcTemplate.queryForList("SELECT DISTINCT user_id FROM aggregators WHERE course_id = ? ORDER BY user_id", String.class, courseId);
    }

    public List<String> courseIds() {
        return jdbcTemplate.queryForList("SELECT DISTINCT course_id FROM aggregators ORDER BY course_id", String.class);
    }

    public int deleteOrphans(String courseId, Set<String> liveBlocks, Instant before) {
        List<String> orphans = jdbcTemplate.queryForList(
                        "SELECT DISTINCT block_key FROM aggregators WHERE course_id = ? AND modified < ?",
                        String.class, courseId, before.toEpochMilli()).stream()
                .filter(block -> !liveBlocks.contains(block))
                .toList();
        int deleted = 0;
        for (String block : orphans) {
            deleted += jdbcTemplate.update(
                    "DELETE FROM aggregators WHERE course_id = ? AND block_key = ? AND modified < ?",
                    courseId, block, before.toEpochMilli());
        }
        return deleted;
    }

    public record StoredAggregate(String userId,
                                  String courseId,
                                  String blockKey,
                                  String aggregationName,
                                  double earned,
                                  double possible,
                                  Instant modified) {
        public AggregateResult toResult() {
            return new AggregateResult(blockKey, earned, possible);
        }
    }
}
