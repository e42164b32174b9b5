package io.postrelay.storage;

import io.postrelay.model.PacketId;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.TimedOutPostRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class TimedOutPostStore {
    private final Database database;

    public TimedOutPostStore(Database database) {
        this.database = database;
    }

    /**
     * Resolves {@code packetId} as timed out and appends the timed-out post in the same transaction.
     * Returns empty, writing nothing, if the packet already has a resolution.
     */
    public Optional<TimedOutPostRecord> appendForPacket(PacketId packetId, String creator, String title, String chain) {
        long nowMs = Instant.now().toEpochMilli();
        return database.write("Failed to append timed-out post", c -> {
            if (!PacketResolutionStore.claim(c, packetId, PacketResolution.TIMED_OUT, null, nowMs)) {
                return Optional.empty();
            }
            long id = RecordCounters.next(c, RecordCounters.TIMED_OUT_POST);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO timed_out_posts(id,creator,title,chain,source_port,source_channel,sequence,created_at_ms) VALUES(?,?,?,?,?,?,?,?)")) {
                ps.setLong(1, id);
                ps.setString(2, creator);
                ps.setString(3, title);
                ps.setString(4, chain);
                ps.setString(5, packetId.sourcePort());
                ps.setString(6, packetId.sourceChannel());
                ps.setLong(7, packetId.sequence());
                ps.setLong(8, nowMs);
                ps.executeUpdate();
            }
            return Optional.of(new TimedOutPostRecord(id, creator, title, chain));
        });
    }

    public Optional<TimedOutPostRecord> get(long id) {
        String sql = "SELECT id,creator,title,chain FROM timed_out_posts WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read timed-out post", e);
        }
    }

    public List<TimedOutPostRecord> list(int limit, int offset) {
        String sql = "SELECT id,creator,title,chain FROM timed_out_posts ORDER BY id ASC LIMIT ? OFFSET ?";
        List<TimedOutPostRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            ps.setInt(2, Math.max(0, offset));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list timed-out posts", e);
        }
    }

    public long count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM timed_out_posts");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count timed-out posts", e);
        }
    }

    private static TimedOutPostRecord map(ResultSet rs) throws SQLException {
        return new TimedOutPostRecord(
                rs.getLong("id"),
                rs.getString("creator"),
                rs.getString("title"),
                rs.getString("chain")
        );
    }
}
