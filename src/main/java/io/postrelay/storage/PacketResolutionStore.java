package io.postrelay.storage;

import io.postrelay.model.PacketId;
import io.postrelay.model.PacketResolution;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Which terminal outcome each originated packet reached. A packet can be resolved once; the first
 * writer wins and later attempts see {@code false} from {@link #claim}.
 */
public final class PacketResolutionStore {
    private final Database database;

    public PacketResolutionStore(Database database) {
        this.database = database;
    }

    /** Marks {@code packetId} as answered by an error acknowledgement. Returns false if it was already resolved. */
    public boolean recordAckError(PacketId packetId, String message) {
        long nowMs = Instant.now().toEpochMilli();
        return database.write("Failed to record packet resolution",
                c -> claim(c, packetId, PacketResolution.ACK_ERROR, message, nowMs));
    }

    public Optional<Resolved> find(PacketId packetId) {
        String sql = "SELECT outcome,detail,resolved_at_ms FROM packet_resolutions WHERE source_port=? AND source_channel=? AND sequence=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, packetId.sourcePort());
            ps.setString(2, packetId.sourceChannel());
            ps.setLong(3, packetId.sequence());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new Resolved(
                        packetId,
                        PacketResolution.valueOf(rs.getString("outcome")),
                        rs.getString("detail"),
                        rs.getLong("resolved_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read packet resolution", e);
        }
    }

    /**
     * Highest sequence resolved so far on {@code (sourcePort, sourceChannel)}, compared unsigned.
     * SQLite stores sequences as signed integers, so values past {@link Long#MAX_VALUE} read back
     * negative and outrank every non-negative one.
     */
    public OptionalLong lastSequence(String sourcePort, String sourceChannel) {
        String sql = "SELECT COALESCE(MAX(CASE WHEN sequence < 0 THEN sequence END), MAX(sequence))"
                + " FROM packet_resolutions WHERE source_port=? AND source_channel=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sourcePort);
            ps.setString(2, sourceChannel);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return OptionalLong.empty();
                long max = rs.getLong(1);
                return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(max);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read last resolved sequence", e);
        }
    }

    static boolean claim(Connection c, PacketId packetId, PacketResolution outcome, String detail, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO packet_resolutions(source_port,source_channel,sequence,outcome,detail,resolved_at_ms) VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, packetId.sourcePort());
            ps.setString(2, packetId.sourceChannel());
            ps.setLong(3, packetId.sequence());
            ps.setString(4, outcome.name());
            ps.setString(5, detail);
            ps.setLong(6, nowMs);
            return ps.executeUpdate() == 1;
        }
    }

    public record Resolved(PacketId packetId, PacketResolution outcome, String detail, long resolvedAtMs) {
    }
}
