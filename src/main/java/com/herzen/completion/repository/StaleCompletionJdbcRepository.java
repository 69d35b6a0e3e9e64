package com.herzen.completion.repository;

import com.herzen.completion.staleness.StalenessModels.StaleRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Repository
public class StaleCompletionJdbcRepository {
    private static final String COLUMNS =
            "id, user_id, course_id, block_key, force_recompute, claim_token, claim_expires, resolved, created, modified";
    private static final String CLAIMABLE = "resolved = FALSE AND (claim_token IS NULL OR claim_expires < ?)";
    // Another token holds a live claim on the same (user, course) pair.
    private static final String RIVAL_CLAIM =
            "SELECT 1 FROM stale_completions o WHERE o.user_id = s.user_id AND o.course_id = s.course_id " +
                    "AND o.resolved = FALSE AND o.claim_token IS NOT NULL AND o.claim_token <> ? AND o.claim_expires >= ?";

    private static final RowMapper<StaleRecord> MAPPER = (rs, n) -> new StaleRecord(
            rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getBoolean(5), rs.getString(6),
            toInstant((Long) rs.getObject(7)), rs.getBoolean(8),
            Instant.ofEpochMilli(rs.getLong(9)), Instant.ofEpochMilli(rs.getLong(10)));

    private final JdbcTemplate jdbcTemplate;

    public StaleCompletionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    // a differing scope widens to the whole course; force is sticky
    public int widenOpen(String openKey, String blockKey, boolean force, long now) {
        return jdbcTemplate.update(
                "UPDATE stale_completions SET " +
                        "block_key = CASE WHEN block_key = CAST(? AS VARCHAR(255)) THEN block_key ELSE NULL END, " +
                        "force_recompute = (force_recompute OR CAST(? AS BOOLEAN)), modified = ? " +
                        "WHERE open_key = ?",
                blockKey, force, now, openKey);
    }

    public long insertOpen(String openKey, String userId, String courseId, String blockKey, boolean force, long now) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO stale_completions(user_id, course_id, block_key, force_recompute, open_key, resolved, created, modified) " +
                            "VALUES (?,?,?,?,?,FALSE,?,?)",
                    new String[]{"ID"});
            ps.setString(1, userId);
            ps.setString(2, courseId);
            if (blockKey == null) ps.setNull(3, Types.VARCHAR); else ps.setString(3, blockKey);
            ps.setBoolean(4, force);
            ps.setString(5, openKey);
            ps.setLong(6, now);
            ps.setLong(7, now);
            return ps;
        }, keyHolder);
        return keyHolder.getKey().longValue();
    }

    public List<Long> findClaimableIds(String claimToken, long now, int limit) {
        return jdbcTemplate.queryForList(
                "SELECT s.id FROM stale_completions s WHERE s.resolved = FALSE " +
                        "AND (s.claim_token IS NULL OR s.claim_expires < ?) " +
                        "AND NOT EXISTS (" + RIVAL_CLAIM + ") ORDER BY s.id LIMIT ?",
                Long.class, now, claimToken, now, limit);
    }

    /**
     * Conditional claim of a single record. The UPDATE evaluates the claimable predicate again, so of several
     * workers racing for the same row exactly one sees an update count of 1. Rows whose pair is already claimed
     * under another token are skipped.
     */
    public int tryClaim(long id, String claimToken, long claimExpires, long now) {
        return jdbcTemplate.update(
                "UPDATE stale_completions s SET claim_token = ?, claim_expires = ?, open_key = NULL " +
                        "WHERE s.id = ? AND s.resolved = FALSE AND (s.claim_token IS NULL OR s.claim_expires < ?) " +
                        "AND NOT EXISTS (" + RIVAL_CLAIM + ")",
                claimToken, claimExpires, id, now, claimToken, now);
    }

    public boolean hasRivalClaim(String userId, String courseId, String claimToken, long now) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM stale_completions WHERE user_id = ? AND course_id = ? AND resolved = FALSE " +
                        "AND claim_token IS NOT NULL AND claim_token <> ? AND claim_expires >= ?",
                Integer.class, userId, courseId, claimToken, now);
        return count != null && count > 0;
    }

    public int releaseClaim(Collection<Long> ids, String claimToken) {
        if (ids.isEmpty()) return 0;
        List<Object> args = new ArrayList<>();
        args.add(claimToken);
        args.addAll(ids);
        return jdbcTemplate.update(
                "UPDATE stale_completions SET claim_token = NULL, claim_expires = NULL " +
                        "WHERE claim_token = ? AND id IN (" + placeholders(ids.size()) + ")",
                args.toArray());
    }

    public List<StaleRecord> findByClaimToken(String claimToken) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM stale_completions WHERE claim_token = ? AND resolved = FALSE ORDER BY id",
                MAPPER, claimToken);
    }

    public int resolve(Collection<Long> ids, long now) {
        if (ids.isEmpty()) return 0;
        List<Object> args = new ArrayList<>();
        args.add(now);
        args.addAll(ids);
        return jdbcTemplate.update(
                "UPDATE stale_completions SET resolved = TRUE, open_key = NULL, modified = ? " +
                        "WHERE resolved = FALSE AND id IN (" + placeholders(ids.size()) + ")",
                args.toArray());
    }

    public int resolveUnclaimedBefore(String userId, String courseId, long before, long now) {
        return jdbcTemplate.update(
                "UPDATE stale_completions SET resolved = TRUE, open_key = NULL, modified = ? " +
                        "WHERE user_id = ? AND course_id = ? AND modified < ? AND " + CLAIMABLE,
                now, userId, courseId, before, now);
    }

    public int releaseExpired(long now) {
        return jdbcTemplate.update(
                "UPDATE stale_completions SET claim_token = NULL, claim_expires = NULL " +
                        "WHERE resolved = FALSE AND claim_token IS NOT NULL AND claim_expires < ?",
                now);
    }

    public List<StaleRecord> findPending(String userId, String courseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM stale_completions WHERE user_id = ? AND course_id = ? AND resolved = FALSE ORDER BY id",
                MAPPER, userId, courseId);
    }

    public Optional<StaleRecord> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM stale_completions WHERE id = ?", MAPPER, id)
                .stream().findFirst();
    }

    public long countPending() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM stale_completions WHERE resolved = FALSE", Long.class);
        return count == null ? 0L : count;
    }

    public int deleteResolvedBefore(long cutoff) {
        return jdbcTemplate.update("DELETE FROM stale_completions WHERE resolved = TRUE AND modified < ?", cutoff);
    }

    private static Instant toInstant(Long epochMillis) {
        return epochMillis == null ? null : Instant.ofEpochMilli(epochMillis);
    }

    private static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }
}
