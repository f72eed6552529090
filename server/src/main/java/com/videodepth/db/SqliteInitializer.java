package com.videodepth.db;

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

                // One row per sampled pair list, keyed by the inputs that produced it
                stmt.execute("CREATE TABLE IF NOT EXISTS sampling_run (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "run_key TEXT NOT NULL UNIQUE, " +
                        "flow_ops TEXT NOT NULL, " +
                        "two_way INTEGER NOT NULL, " +
                        "pair_count INTEGER NOT NULL, " +
                        "pairs_blob BLOB, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_run_flow_ops " +
                        "ON sampling_run (flow_ops, two_way);");
            }
        }
    }
}
