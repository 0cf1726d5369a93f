package com.wordhmm.db;

import com.wordhmm.server.ai.hmm.WordHmm;
import com.wordhmm.util.DoubleArrayCodec;

import java.sql.*;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores word model parameters in the log domain as raw doubles, so a reloaded
 * model evaluates exactly like the one that was saved.
 */
public class WordModelDao {

    private final String dbPath;

    public WordModelDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public void save(String word, WordHmm hmm) throws SQLException {
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO word_model (word, state_labels, epsilon, initial_log_prob, " +
                "transition_log_prob, updated_ts) VALUES (?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(word) DO UPDATE SET " +
                "state_labels = excluded.state_labels, epsilon = excluded.epsilon, " +
                "initial_log_prob = excluded.initial_log_prob, " +
                "transition_log_prob = excluded.transition_log_prob, updated_ts = excluded.updated_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, word);
            ps.setString(2, encodeLabels(hmm.getStateLabels()));
            ps.setDouble(3, hmm.getEpsilon());
            ps.setBytes(4, DoubleArrayCodec.toBytes(hmm.getInitialLogProb()));
            ps.setBytes(5, DoubleArrayCodec.matrixToBytes(hmm.getTransitionLogProb()));
            ps.setLong(6, now);
            ps.executeUpdate();
        }
    }

    public Optional<WordHmm> load(String word) throws SQLException {
        String sql = "SELECT state_labels, epsilon, initial_log_prob, transition_log_prob " +
                "FROM word_model WHERE word = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, word);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromRow(rs));
                }
            }
        }
        return Optional.empty();
    }

    public Map<String, WordHmm> findAll() throws SQLException {
        String sql = "SELECT word, state_labels, epsilon, initial_log_prob, transition_log_prob " +
                "FROM word_model ORDER BY word";
        Map<String, WordHmm> models = new LinkedHashMap<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                models.put(rs.getString("word"), fromRow(rs));
            }
        }
        return models;
    }

    public void delete(String word) throws SQLException {
        String sql = "DELETE FROM word_model WHERE word = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, word);
            ps.executeUpdate();
        }
    }

    private WordHmm fromRow(ResultSet rs) throws SQLException {
        int[] labels = decodeLabels(rs.getString("state_labels"));
        double epsilon = rs.getDouble("epsilon");
        double[] initial = DoubleArrayCodec.fromBytes(rs.getBytes("initial_log_prob"));
        double[][] transitions = DoubleArrayCodec.matrixFromBytes(rs.getBytes("transition_log_prob"),
                labels.length);
        return WordHmm.fromLogParameters(labels, initial, transitions, epsilon);
    }

    static String encodeLabels(int[] labels) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < labels.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(labels[i]);
        }
        return sb.toString();
    }

    static int[] decodeLabels(String text) {
        String[] parts = text.split(",");
        int[] labels = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            labels[i] = Integer.parseInt(parts[i].trim());
        }
        return labels;
    }
}
