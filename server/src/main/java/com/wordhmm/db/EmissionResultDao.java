package com.wordhmm.db;

import com.wordhmm.util.DoubleArrayCodec;

import java.sql.*;
import java.util.Optional;

public class EmissionResultDao {

    private final String dbPath;

    public EmissionResultDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<double[][]> loadLikelihoods(long utteranceId, String providerType, String providerVersion)
            throws SQLException {
        String sql = "SELECT num_classes, likelihoods_blob FROM emission_result " +
                "WHERE utterance_id = ? AND provider_type = ? AND provider_version = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, utteranceId);
            ps.setString(2, providerType);
            ps.setString(3, providerVersion);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    int cols = rs.getInt("num_classes");
                    byte[] blob = rs.getBytes("likelihoods_blob");
                    return Optional.ofNullable(DoubleArrayCodec.matrixFromBytes(blob, cols));
                }
            }
        }
        return Optional.empty();
    }

    public void upsertLikelihoods(long utteranceId, String providerType, String providerVersion,
            double[][] likelihoods) throws SQLException {
        byte[] blob = DoubleArrayCodec.matrixToBytes(likelihoods);
        int cols = likelihoods.length == 0 ? 0 : likelihoods[0].length;
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO emission_result (utterance_id, provider_type, provider_version, " +
                "num_frames, num_classes, likelihoods_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(utterance_id, provider_type, provider_version) DO UPDATE SET " +
                "num_frames = excluded.num_frames, num_classes = excluded.num_classes, " +
                "likelihoods_blob = excluded.likelihoods_blob, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, utteranceId);
            ps.setString(2, providerType);
            ps.setString(3, providerVersion);
            ps.setInt(4, likelihoods.length);
            ps.setInt(5, cols);
            ps.setBytes(6, blob);
            ps.setLong(7, now);
            ps.executeUpdate();
        }
    }

    public void deleteByProvider(String providerType, String providerVersion) throws SQLException {
        String sql = "DELETE FROM emission_result WHERE provider_type = ? AND provider_version = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, providerType);
            ps.setString(2, providerVersion);
            ps.executeUpdate();
        }
    }

    public void deleteByUtterance(long utteranceId) throws SQLException {
        String sql = "DELETE FROM emission_result WHERE utterance_id = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, utteranceId);
            ps.executeUpdate();
        }
    }
}
