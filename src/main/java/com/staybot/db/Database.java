package com.staybot.db;

import com.staybot.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Connection manager for the local SQLite file.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private final SQLiteDataSource dataSource;
    private final Path path;
    private final boolean sqlLogEnabled;

    public Database(Path path, int busyTimeoutMs, boolean sqlLogEnabled) {
        if (path == null) {
            throw new IllegalArgumentException("db.path must not be empty");
        }
        this.path = path.toAbsolutePath().normalize();
        this.sqlLogEnabled = sqlLogEnabled;
        try {
            Path parent = this.path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create database directory for " + this.path, e);
        }

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout(Math.max(0, busyTimeoutMs));
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);

        SQLiteDataSource ds = new SQLiteDataSource(sqlite);
        ds.setUrl("jdbc:sqlite:" + this.path);
        this.dataSource = ds;
    }

    public static Database fromConfig(Config config) {
        return new Database(
                config.getPath("db.path"),
                config.getInt("db.busy_timeout_ms"),
                config.getBoolean("db.sql_log.enabled", false)
        );
    }

    public Connection connect() throws SQLException {
        try {
            Connection raw = dataSource.getConnection();
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String details = "DB connect failed: path=" + path
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    /**
     * Writes a consistent copy of the live database to {@code target}, replacing any file there.
     */
    public Path backupTo(Path target) throws SQLException {
        Path resolved = target.toAbsolutePath().normalize();
        try {
            Path parent = resolved.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.deleteIfExists(resolved);
        } catch (IOException e) {
            throw new SQLException("backup target not writable: " + resolved, e);
        }
        String literal = resolved.toString().replace("'", "''");
        try (Connection conn = connect(); Statement st = conn.createStatement()) {
            st.execute("VACUUM INTO '" + literal + "'");
        }
        LOG.info("Database backup written. path={}", resolved);
        return resolved;
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("locked") || msg.contains("busy")) {
            return "locked";
        }
        if (msg.contains("no such file") || msg.contains("cannot open") || msg.contains("does not exist")) {
            return "missing_dir";
        }
        return "connection_error";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
