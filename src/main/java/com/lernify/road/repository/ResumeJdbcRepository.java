package com.lernify.road.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ResumeJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ResumeJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsert(String userId, String documentJson) {
        jdbcTemplate.update("MERGE INTO resumes(user_id, document, updated_at) KEY(user_id) VALUES (?,?,?)",
                userId, documentJson, Instant.now().toString());
    }

    public Optional<String> find(String userId) {
        List<String> rows = jdbcTemplate.query("SELECT document FROM resumes WHERE user_id = ?",
                (rs, n) -> rs.getString(1), userId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
