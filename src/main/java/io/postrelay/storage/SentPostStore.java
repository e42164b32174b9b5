package io.postrelay.storage;

import io.postrelay.model.PacketId;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.SentPostRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Posts the counterparty chain acknowledged, one row per originated packet.
 */
public final class SentPostStore {
    private final Database database;

    public SentPostStore(Database database) {
        this.database = database;
    }

    /**
     * Resolves {@code packetId} as acknowledged and appends the sent post in the same transaction.
     * Returns empty, writing nothing, if the packet already has a resolution.
     */
    public Optional<SentPostRecord> appendForPacket(PacketId packetId, String creator, String postId, String title, String chain) {
        long nowMs = Instant.now().toEpochMilli();
        return database.write("Failed to append sent post", c -> {
            if (!PacketResolutionStore.claim(c, packetId, PacketResolution.ACKNOWLEDGED, postId, nowMs)) {
                return Optional.empty();
            }
            long id = RecordCounters.next(c, RecordCounters.SENT_POST);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO sent_posts(id,creator,post_id,title,chain,source_port,source_channel,sequence,created_at_ms) VALUES(?,?,?,?,?,?,?,?,?)")) {
                ps.setLong(1, id);
                ps.setString(2, creator);
                ps.setString(3, postId);
                ps.setString(4, title);
                ps.setString(5, chain);
                ps.setString(6, packetId.sourcePort());
                ps.setString(7, packetId.sourceChannel());
                ps.setLong(8, packetId.sequence());
                ps.setLong(9, nowMs);
                ps.executeUpdate();
            }
            return Optional.of(new SentPostRecord(id, creator, postId, title, chain));
        });
    }

    public Optional<SentPostRecord> get(long id) {
        String sql = "SELECT id,creator,post_id,title,chain FROM sent_posts WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read sent post", e);
        }
    }

    public List<SentPostRecord> list(int limit, int offset) {
        String sql = "SELECT id,creator,post_id,title,chain FROM sent_posts ORDER BY id ASC LIMIT ? OFFSET ?";
        List<SentPostRecord> out = new ArrayList<>();
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
            throw new RuntimeException("Failed to list sent posts", e);
        }
    }

    public long count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM sent_posts");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count sent posts", e);
        }
    }

    private static SentPostRecord map(ResultSet rs) throws SQLException {
        return new SentPostRecord(
                rs.getLong("id"),
                rs.getString("creator"),
                rs.getString("post_id"),
                rs.getString("title"),
                rs.getString("chain")
        );
    }
}
