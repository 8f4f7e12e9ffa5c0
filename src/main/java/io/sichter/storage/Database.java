package io.sichter.storage;

import io.sichter.config.SichterConfig;
import io.sichter.error.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final SichterConfig config;
    private final String jdbcUrl;

    public Database(SichterConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new StorageException("Failed to create state root " + config.rootDir(), e);
        }
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        job_id TEXT PRIMARY KEY,
                        type TEXT NOT NULL,
                        mode TEXT NOT NULL,
                        repo TEXT,
                        auto_pr INTEGER NOT NULL DEFAULT 1,
                        status TEXT NOT NULL,
                        last_error TEXT,
                        output TEXT,
                        enqueued_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        finished_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status, updated_at_ms)");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize job ledger schema at " + config.dbFile(), e);
        }
    }
}
