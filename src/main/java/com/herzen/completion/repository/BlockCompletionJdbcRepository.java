package com.herzen.completion.repository;

import com.herzen.completion.source.CompletionSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.*;

@Repository
public class BlockCompletionJdbcRepository implements CompletionSource {
    private final JdbcTemplate jdbcTemplate;

    public BlockCompletionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Map<String, Double> getLeafValues(String userId, String courseId, Collection<String> blockIds) {
        List<Object> args = new ArrayList<>(List.of(userId, courseId));
        String blockFilter = "";
        if (blockIds != null) {
            if (blockIds.isEmpty()) return Map.of();
            blockFilter = " AND block_key IN (" + String.join(",", Collections.nCopies(blockIds.size(), "?")) + ")";
            args.addAll(blockIds);
        }
        Map<String, Double> values = new HashMap<>();
        jdbcTemplate.query(
                "SELECT block_key, completion FROM block_completions WHERE user_id = ? AND course_id = ?" + blockFilter,
                rs -> {
                    values.put(rs.getString(1), rs.getDouble(2));
                },
                args.toArray());
        return values;
    }

    @Override
    public List<String> usersWithCompletions(String courseId) {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT user_id FROM block_completions WHERE course_id = ? ORDER BY user_id", String.class, courseId);
    }

    public void save(String userId, String courseId, String blockKey, double completion, Instant modified) {
        jdbcTemplate.update(
                "MERGE INTO block_completions(user_id, course_id, block_key, completion, modified) KEY(user_id, course_id, block_key) VALUES (?,?,?,?,?)",
                userId, courseId, blockKey, completion, modified.toEpochMilli());
    }
}
