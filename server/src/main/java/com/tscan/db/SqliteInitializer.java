package com.tscan.db;

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

                // One row per group stem
                stmt.execute("CREATE TABLE IF NOT EXISTS images (" +
                        "stem TEXT PRIMARY KEY, " +
                        "status TEXT, " +
                        "candidates_json TEXT, " +
                        "candidates_count INTEGER, " +
                        "has_ai INTEGER, " +
                        "max_ai REAL, " +
                        "crop_rect TEXT, " +
                        "params_hash TEXT, " +
                        "timestamp INTEGER" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_images_status ON images (status);");
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_images_ts ON images (timestamp);");
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_images_max_ai ON images (max_ai);");
            }
        }
    }
}
