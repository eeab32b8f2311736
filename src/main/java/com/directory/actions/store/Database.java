package com.directory.actions.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * SQLite database holding jobs, the audit trail and the operator roster.
 * Connections are opened per operation; the file survives restarts.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final Path dbFile;
    private final String jdbcUrl;

    public Database(Path dbFile) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toAbsolutePath();
    }

    public Path dbFile() {
        return dbFile;
    }

    /**
     * Creates the parent directory, the schema and sets WAL journaling. Safe to call repeatedly.
     */
    public void init() {
        initDirectories();
        initSchema();
        applyPragmas();
        log.info("Database initialized: {}", dbFile.toAbsolutePath());
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
            st.execute("PRAGMA synchronous=FULL");
        }
        return conn;
    }

    private void initDirectories() {
        Path parent = dbFile.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new JobPersistenceException("Failed to create database directory " + parent, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        job_type TEXT NOT NULL,
                        target_handle TEXT NOT NULL,
                        run_at TEXT NOT NULL,
                        run_at_epoch INTEGER NOT NULL,
                        status TEXT NOT NULL DEFAULT 'SCHEDULED',
                        created_by TEXT,
                        meta TEXT,
                        created_at_ms INTEGER NOT NULL,
                        finished_at_ms INTEGER,
                        last_error TEXT
                    )
                    """);
            // At most one live row per (type, handle, due second)
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS ux_jobs_live
                    ON jobs(job_type, target_handle, run_at_epoch)
                    WHERE status IN ('SCHEDULED', 'IN_PROGRESS')
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS ix_jobs_status_run_at ON jobs(status, run_at_epoch)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS audit_logs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        entry_id TEXT NOT NULL UNIQUE,
                        ts TEXT NOT NULL,
                        ts_ms INTEGER NOT NULL,
                        actor_id TEXT,
                        action TEXT NOT NULL,
                        target TEXT,
                        details TEXT
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS ix_audit_target ON audit_logs(target)");
            st.execute("CREATE INDEX IF NOT EXISTS ix_audit_action ON audit_logs(action)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS admins (
                        user_id TEXT PRIMARY KEY,
                        added_by TEXT,
                        added_at_ms INTEGER NOT NULL
                    )
                    """);
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to initialize schema", e);
        }
    }

    private void applyPragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                String mode = rs.next() ? rs.getString(1) : "";
                if (!"wal".equals(mode.toLowerCase(Locale.ROOT))) {
                    log.warn("SQLite journal_mode is '{}', expected 'wal'", mode);
                }
            }
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to apply SQLite pragmas", e);
        }
    }
}
