package io.postrelay.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Per-log id counters. Ids start at 0 and are never handed out twice, even if rows are removed.
 * Callers must hold the database writer lock and an open transaction.
 */
final class RecordCounters {
    static final String POST = "post";
    static final String SENT_POST = "sent_post";
    static final String TIMED_OUT_POST = "timed_out_post";

    private RecordCounters() {
    }

    static long next(Connection c, String counterKey) throws SQLException {
        long current = 0L;
        try (PreparedStatement ps = c.prepareStatement("SELECT next_value FROM record_counters WHERE counter_key=?")) {
            ps.setString(1, counterKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    current = rs.getLong(1);
                }
            }
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO record_counters(counter_key,next_value) VALUES(?,?) "
                        + "ON CONFLICT(counter_key) DO UPDATE SET next_value=excluded.next_value")) {
            ps.setString(1, counterKey);
            ps.setLong(2, current + 1L);
            ps.executeUpdate();
        }
        return current;
    }

    static long peek(Connection c, String counterKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT next_value FROM record_counters WHERE counter_key=?")) {
            ps.setString(1, counterKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }
}
