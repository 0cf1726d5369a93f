package com.wordhmm.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS utterance (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "utterance_rel_path TEXT NOT NULL UNIQUE, " +
                        "content_hash TEXT, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                // T x L likelihood matrices, row-major
                stmt.execute("CREATE TABLE IF NOT EXISTS emission_result (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "utterance_id INTEGER NOT NULL, " +
                        "provider_type TEXT NOT NULL, " +
                        "provider_version TEXT NOT NULL, " +
                        "num_frames INTEGER NOT NULL, " +
                        "num_classes INTEGER NOT NULL, " +
                        "likelihoods_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (utterance_id, provider_type, provider_version), " +
                        "FOREIGN KEY (utterance_id) REFERENCES utterance(id) ON DELETE CASCADE" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_provider_lookup " +
                        "ON emission_result (provider_type, provider_version, utterance_id);");

                stmt.execute("CREATE TABLE IF NOT EXISTS word_model (" +
                        "word TEXT PRIMARY KEY, " +
                        "state_labels TEXT NOT NULL, " +
                        "epsilon REAL NOT NULL, " +
                        "initial_log_prob BLOB NOT NULL, " +
                        "transition_log_prob BLOB NOT NULL, " +
                        "updated_ts INTEGER NOT NULL" +
                        ");");
            }
        }
    }
}
