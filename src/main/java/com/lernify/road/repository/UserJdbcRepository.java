package com.lernify.road.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class UserJdbcRepository {
    private static final String USER_COLUMNS = "u.id, u.first_name, u.last_name, u.email, u.phone, u.qualification, u.password_hash";
    private static final RowMapper<UserRow> USER_ROW = (rs, n) -> new UserRow(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
            rs.getString(5), rs.getString(6), rs.getString(7));

    private final JdbcTemplate jdbcTemplate;

    public UserJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(UserRow user) {
        jdbcTemplate.update(
                "INSERT INTO users(id, first_name, last_name, email, phone, qualification, password_hash, created_at) VALUES (?,?,?,?,?,?,?,?)",
                user.id(), user.firstName(), user.lastName(), user.email(), user.phone(), user.qualification(),
                user.passwordHash(), Instant.now().toString());
    }

    public boolean existsByEmail(String email) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM users WHERE email = ?", Long.class, email);
        return count != null && count > 0;
    }

    public Optional<UserRow> findById(String id) {
        return first(jdbcTemplate.query("SELECT " + USER_COLUMNS + " FROM users u WHERE u.id = ?", USER_ROW, id));
    }

    public Optional<UserRow> findByEmail(String email) {
        return first(jdbcTemplate.query("SELECT " + USER_COLUMNS + " FROM users u WHERE u.email = ?", USER_ROW, email));
    }

    public Optional<UserRow> findByToken(String token) {
        return first(jdbcTemplate.query(
                "SELECT " + USER_COLUMNS + " FROM users u JOIN user_tokens t ON t.user_id = u.id WHERE t.token = ?",
                USER_ROW, token));
    }

    public void addToken(String userId, String token) {
        jdbcTemplate.update("MERGE INTO user_tokens(token, user_id, issued_at) KEY(token) VALUES (?,?,?)",
                token, userId, Instant.now().toString());
    }

    public void updatePasswordHash(String userId, String passwordHash) {
        jdbcTemplate.update("UPDATE users SET password_hash = ? WHERE id = ?", passwordHash, userId);
    }

    public void updateProfile(String userId, String firstName, String lastName, String phone) {
        jdbcTemplate.update(
                "UPDATE users SET first_name = COALESCE(?, first_name), last_name = COALESCE(?, last_name), phone = COALESCE(?, phone) WHERE id = ?",
                firstName, lastName, phone, userId);
    }

    private static Optional<UserRow> first(List<UserRow> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public record UserRow(String id,
                          String firstName,
                          String lastName,
                          String email,
                          String phone,
                          String qualification,
                          String passwordHash) {}
}
