package com.wordhmm.db;

import java.sql.*;
import java.util.Optional;

public class UtteranceDao {

    private final String dbPath;

    public UtteranceDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Utterance getOrCreateByPath(String utteranceRelPath, String contentHashOrNull) throws SQLException {
        try (Connection conn = connect()) {
            Optional<Utterance> existing = findByPathInternal(conn, utteranceRelPath);
            if (existing.isPresent()) {
                Utterance utt = existing.get();
                if (contentHashOrNull != null && !contentHashOrNull.equals(utt.getContentHash())) {
                    try (PreparedStatement ps = conn.prepareStatement(
                            "UPDATE utterance SET content_hash = ? WHERE id = ?")) {
                        ps.setString(1, contentHashOrNull);
                        ps.setLong(2, utt.getId());
                        ps.executeUpdate();
                    }
                    return new Utterance(utt.getId(), utt.getUtteranceRelPath(), contentHashOrNull,
                            utt.getCreatedTs());
                }
                return utt;
            }

            long now = System.currentTimeMillis();
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO utterance (utterance_rel_path, content_hash, created_ts) VALUES (?, ?, ?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, utteranceRelPath);
                ps.setString(2, contentHashOrNull);
                ps.setLong(3, now);
                ps.executeUpdate();

                try (ResultSet rs = ps.getGeneratedKeys()) {
                    if (rs.next()) {
                        return new Utterance(rs.getLong(1), utteranceRelPath, contentHashOrNull, now);
                    } else {
                        throw new SQLException("Creating utterance failed, no ID obtained.");
                    }
                }
            } catch (SQLException e) {
                // Another writer inserted the same path in between
                if (e.getMessage() != null && e.getMessage().contains("UNIQUE constraint failed")) {
                    return findByPathInternal(conn, utteranceRelPath)
                            .orElseThrow(() -> new SQLException(
                                    "Failed to find utterance after UNIQUE constraint violation", e));
                }
                throw e;
            }
        }
    }

    public Optional<Utterance> findByPath(String utteranceRelPath) throws SQLException {
        try (Connection conn = connect()) {
            return findByPathInternal(conn, utteranceRelPath);
        }
    }

    private Optional<Utterance> findByPathInternal(Connection conn, String utteranceRelPath) throws SQLException {
        String sql = "SELECT id, utterance_rel_path, content_hash, created_ts FROM utterance "
                + "WHERE utterance_rel_path = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, utteranceRelPath);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Utterance(
                            rs.getLong("id"),
                            rs.getString("utterance_rel_path"),
                            rs.getString("content_hash"),
                            rs.getLong("created_ts")));
                }
            }
        }
        return Optional.empty();
    }
}
