package com.staybot.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent SQLite schema migration runner.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int SCHEMA_VERSION = 1;

    public void run(Database database) throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at INTEGER NOT NULL" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                if (currentVersion != SCHEMA_VERSION) {
                    writeSchemaVersion(conn, SCHEMA_VERSION);
                    LOG.info("Schema migrated. from_version={} to_version={}", currentVersion, SCHEMA_VERSION);
                }
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + SCHEMA_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
        }
    }

    private List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS tracked_items (" +
                "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "identity_key TEXT NOT NULL UNIQUE," +
                "title TEXT NOT NULL," +
                "price REAL NOT NULL," +
                "currency TEXT NOT NULL," +
                "rating REAL NOT NULL DEFAULT 0," +
                "location TEXT NOT NULL DEFAULT ''," +
                "url TEXT NULL," +
                "image_url TEXT NULL," +
                "description TEXT NULL," +
                "amenities TEXT NOT NULL DEFAULT '[]'," +
                "source TEXT NOT NULL," +
                "first_seen INTEGER NOT NULL," +
                "last_seen INTEGER NOT NULL," +
                "times_seen INTEGER NOT NULL DEFAULT 1 CHECK (times_seen >= 1)," +
                "notified INTEGER NOT NULL DEFAULT 0," +
                "last_drop_alert_observation_id INTEGER NULL," +
                "CHECK (last_seen >= first_seen)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_tracked_items_first_seen ON tracked_items(first_seen)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_tracked_items_source ON tracked_items(source)");

        sqls.add("CREATE TABLE IF NOT EXISTS price_observations (" +
                "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "item_id INTEGER NOT NULL REFERENCES tracked_items(id) ON DELETE CASCADE," +
                "price REAL NOT NULL," +
                "currency TEXT NOT NULL," +
                "observed_at INTEGER NOT NULL" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_price_observations_item_time ON price_observations(item_id, observed_at)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_price_observations_time ON price_observations(observed_at)");

        sqls.add("CREATE TABLE IF NOT EXISTS search_records (" +
                "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "criteria_hash TEXT NOT NULL," +
                "criteria_json TEXT NOT NULL," +
                "result_count INTEGER NOT NULL," +
                "duration_ms INTEGER NOT NULL," +
                "recorded_at INTEGER NOT NULL" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_search_records_hash ON search_records(criteria_hash)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_search_records_time ON search_records(recorded_at)");

        sqls.add("CREATE TABLE IF NOT EXISTS notification_records (" +
                "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "item_ids TEXT NOT NULL," +
                "kind TEXT NOT NULL," +
                "success INTEGER NOT NULL," +
                "error TEXT NULL," +
                "recorded_at INTEGER NOT NULL" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_notification_records_time ON notification_records(recorded_at)");

        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return 0;
            }
            try {
                return Integer.parseInt(rs.getString(1).trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring malformed schema_version value: {}", rs.getString(1));
                return 0;
            }
        }
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, ?) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at")) {
            ps.setString(1, String.valueOf(version));
            ps.setLong(2, System.currentTimeMillis());
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }
}
