package com.lernify.road.repository;

import com.lernify.road.progression.ProgressionModels.Attempt;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Append-only attempt history. Rows are never updated or deleted.
 */
@Repository
public class AttemptJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AttemptJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void append(Attempt attempt) {
        jdbcTemplate.update(
                "INSERT INTO attempts(user_id, domain, step_index, score, total, attempted_at) VALUES (?,?,?,?,?,?)",
                attempt.userId(), attempt.domain(), attempt.stepIndex(), attempt.score(), attempt.total(),
                attempt.attemptedAt().toString());
    }

    public List<Attempt> findByUser(String userId) {
        return jdbcTemplate.query(
                "SELECT user_id, domain, step_index, score, total, attempted_at FROM attempts WHERE user_id = ? ORDER BY id",
                (rs, n) -> new Attempt(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4), rs.getInt(5),
                        Instant.parse(rs.getString(6))),
                userId);
    }
}
