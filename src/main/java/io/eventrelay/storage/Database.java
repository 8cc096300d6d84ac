package io.eventrelay.storage;

import io.eventrelay.config.EventRelayConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final EventRelayConfig config;
    private final String jdbcUrl;

    public Database(EventRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS events (
                        sequence_no INTEGER PRIMARY KEY,
                        name TEXT NOT NULL,
                        namespace TEXT NOT NULL,
                        origin TEXT,
                        data TEXT NOT NULL,
                        timestamp_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_events_name ON events(name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_events_namespace ON events(namespace, sequence_no)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_events_origin ON events(origin, sequence_no)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_events_timestamp ON events(timestamp_ms)");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS journal_meta (
                        key TEXT PRIMARY KEY,
                        value INTEGER NOT NULL
                    )
                    """);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA busy_timeout=5000");
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !expected.equalsIgnoreCase(actual.trim())) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
