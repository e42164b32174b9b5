package io.postrelay.storage;

import io.postrelay.config.PostRelayConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite file of one chain. All store appends go through {@link #write}, which holds a single
 * writer lock per database so record ids are handed out strictly in order.
 */
public final class Database {
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final PostRelayConfig config;
    private final String jdbcUrl;
    private final ReentrantLock writeLock = new ReentrantLock();

    public Database(PostRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    /**
     * Runs {@code work} in one transaction under the writer lock. Rolls back and rethrows on any failure.
     */
    public <T> T write(String failureMessage, SqlWork<T> work) {
        writeLock.lock();
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.run(c);
                c.commit();
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException(failureMessage, e);
        } finally {
            writeLock.unlock();
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS record_counters (
                        counter_key TEXT PRIMARY KEY,
                        next_value INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS posts (
                        id INTEGER PRIMARY KEY,
                        creator TEXT NOT NULL,
                        title TEXT NOT NULL,
                        content TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sent_posts (
                        id INTEGER PRIMARY KEY,
                        creator TEXT NOT NULL,
                        post_id TEXT NOT NULL,
                        title TEXT NOT NULL,
                        chain TEXT NOT NULL,
                        source_port TEXT NOT NULL,
                        source_channel TEXT NOT NULL,
                        sequence INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS timed_out_posts (
                        id INTEGER PRIMARY KEY,
                        creator TEXT NOT NULL,
                        title TEXT NOT NULL,
                        chain TEXT NOT NULL,
                        source_port TEXT NOT NULL,
                        source_channel TEXT NOT NULL,
                        sequence INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS packet_resolutions (
                        source_port TEXT NOT NULL,
                        source_channel TEXT NOT NULL,
                        sequence INTEGER NOT NULL,
                        outcome TEXT NOT NULL,
                        detail TEXT,
                        resolved_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(source_port, source_channel, sequence)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_sent_posts_chain ON sent_posts(chain)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_timed_out_posts_chain ON timed_out_posts(chain)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_packet_resolutions_time ON packet_resolutions(resolved_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " returned no value");
            }
            String actual = rs.getString(1);
            if (actual == null || !expected.equalsIgnoreCase(actual.trim())) {
                throw new IllegalStateException("PRAGMA " + pragma + " expected " + expected + " but was " + actual);
            }
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }
}
