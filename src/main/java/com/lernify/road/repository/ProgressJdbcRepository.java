package com.lernify.road.repository;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-user, per-domain high-water mark of completed roadmap steps. A missing row reads as 0.
 */
@Repository
public class ProgressJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ProgressJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public int completed(String userId, String domain) {
        List<Integer> rows = jdbcTemplate.query(
                "SELECT completed FROM user_progress WHERE user_id = ? AND domain = ?",
                (rs, n) -> rs.getInt(1),
                userId, domain);
        return rows.isEmpty() ? 0 : rows.get(0);
    }

    public Map<String, Integer> progress(String userId) {
        Map<String, Integer> progress = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT domain, completed FROM user_progress WHERE user_id = ? ORDER BY domain",
                rs -> {
                    progress.put(rs.getString(1), rs.getInt(2));
                },
                userId);
        return progress;
    }

    public void initialise(String userId, List<String> domains) {
        domains.forEach(domain -> jdbcTemplate.update(
                "INSERT INTO user_progress(user_id, domain, completed) VALUES (?,?,0)", userId, domain));
    }

    /**
     * Moves {@code completed} from {@code expected} to {@code next} only if the stored value is still
     * {@code expected} and {@code next} is larger. Returns false when another writer got there first.
     */
    public boolean compareAndAdvance(String userId, String domain, int expected, int next) {
        if (next <= expected) return false;
        int updated = jdbcTemplate.update(
                "UPDATE user_progress SET completed = ? WHERE user_id = ? AND domain = ? AND completed = ? AND completed < ?",
                next, userId, domain, expected, next);
        if (updated == 1) return true;
        if (expected != 0 || hasRow(userId, domain)) return false;

        // no row yet reads as 0
        try {
            jdbcTemplate.update("INSERT INTO user_progress(user_id, domain, completed) VALUES (?,?,?)", userId, domain, next);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    private boolean hasRow(String userId, String domain) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM user_progress WHERE user_id = ? AND domain = ?", Long.class, userId, domain);
        return count != null && count > 0;
    }
}
