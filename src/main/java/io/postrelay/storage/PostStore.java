package io.postrelay.storage;

import io.postrelay.model.PostRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of posts on this chain, both locally created and received from other chains.
 */
public final class PostStore {
    private final Database database;

    public PostStore(Database database) {
        this.database = database;
    }

    public PostRecord append(String creator, String title, String content) {
        long nowMs = Instant.now().toEpochMilli();
        return database.write("Failed to append post", c -> {
            long id = RecordCounters.next(c, RecordCounters.POST);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO posts(id,creator,title,content,created_at_ms) VALUES(?,?,?,?,?)")) {
                ps.setLong(1, id);
                ps.setString(2, creator);
                ps.setString(3, title);
                ps.setString(4, content == null ? "" : content);
                ps.setLong(5, nowMs);
                ps.executeUpdate();
            }
            return new PostRecord(id, creator, title, content == null ? "" : content);
        });
    }

    public Optional<PostRecord> get(long id) {
        String sql = "SELECT id,creator,title,content FROM posts WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read post", e);
        }
    }

    public List<PostRecord> list(int limit, int offset) {
        String sql = "SELECT id,creator,title,content FROM posts ORDER BY id ASC LIMIT ? OFFSET ?";
        List<PostRecord> out = new ArrayList<>();
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
            throw new RuntimeException("Failed to list posts", e);
        }
    }

    public long count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM posts");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count posts", e);
        }
    }

    /** Id the next appended post will get. */
    public long nextId() {
        try (Connection c = database.openConnection()) {
            return RecordCounters.peek(c, RecordCounters.POST);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read post counter", e);
        }
    }

    private static PostRecord map(ResultSet rs) throws SQLException {
        return new PostRecord(
                rs.getLong("id"),
                rs.getString("creator"),
                rs.getString("title"),
                rs.getString("content")
        );
    }
}
