package io.agentbridge.storage;

import io.agentbridge.error.NotFoundException;
import io.agentbridge.error.StoreUnavailableException;
import io.agentbridge.model.AgentRegistration;
import io.agentbridge.model.Message;
import io.agentbridge.model.MessageStatus;
import io.agentbridge.model.MessageType;
import io.agentbridge.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable message log backed by SQLite.
 *
 * <p>Every write is a single statement, so status transitions never race:
 * acknowledgment is a conditional UPDATE guarded by {@code status='SENT'}.
 * Creation timestamps are assigned inside the INSERT and never go below the
 * newest stored timestamp; {@code seq} breaks ties in insertion order.
 */
public final class MessageStore {
    private static final String COLUMNS =
            "seq,id,sender,recipient,type,payload,context_id,status,created_at_ms,acknowledged_by,acknowledged_at_ms,updated_at_ms";

    private final Database database;

    public MessageStore(Database database) {
        this.database = database;
    }

    public Message insert(NewMessage m) {
        String sql = """
                INSERT INTO messages(id,sender,recipient,type,payload,context_id,status,created_at_ms,updated_at_ms)
                SELECT ?,?,?,?,?,?,?,
                       MAX(?, COALESCE((SELECT MAX(created_at_ms) FROM messages), 0)),
                       MAX(?, COALESCE((SELECT MAX(created_at_ms) FROM messages), 0))
                """;
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, m.id());
                ps.setString(2, m.sender());
                ps.setString(3, m.recipient());
                ps.setString(4, m.type().name());
                ps.setString(5, Jsons.toCompactJson(m.payload() == null ? Map.of() : m.payload()));
                if (m.contextId() == null) {
                    ps.setNull(6, Types.VARCHAR);
                } else {
                    ps.setString(6, m.contextId());
                }
                ps.setString(7, MessageStatus.SENT.name());
                ps.setLong(8, m.nowMs());
                ps.setLong(9, m.nowMs());
                ps.executeUpdate();
            }
            return findById(c, m.id())
                    .orElseThrow(() -> new IllegalStateException("Inserted message not readable: " + m.id()));
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to insert message " + m.id() + ": " + e.getMessage(), e);
        }
    }

    public Optional<Message> findById(String id) {
        try (Connection c = database.openConnection()) {
            return findById(c, id);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read message " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * Messages addressed to {@code recipient}, newest first. When {@code afterId}
     * names a stored message only messages created after it are returned; an
     * unknown cursor is ignored.
     */
    public List<Message> listForRecipient(String recipient, MessageType type, String afterId, int limit) {
        try (Connection c = database.openConnection()) {
            StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM messages WHERE recipient=?");
            List<Object> args = new ArrayList<>();
            args.add(recipient);
            if (type != null) {
                sql.append(" AND type=?");
                args.add(type.name());
            }
            if (afterId != null && !afterId.isBlank()) {
                Optional<Message> cursor = findById(c, afterId);
                if (cursor.isPresent()) {
                    sql.append(" AND (created_at_ms>? OR (created_at_ms=? AND seq>?))");
                    args.add(cursor.get().createdAtMs());
                    args.add(cursor.get().createdAtMs());
                    args.add(cursor.get().seq());
                }
            }
            sql.append(" ORDER BY created_at_ms DESC, seq DESC LIMIT ?");
            args.add(Math.max(1, limit));
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                bind(ps, args);
                return readAll(ps);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list messages for " + recipient + ": " + e.getMessage(), e);
        }
    }

    public List<Message> listByContext(String contextId) {
        String sql = "SELECT " + COLUMNS + " FROM messages WHERE context_id=? ORDER BY created_at_ms ASC, seq ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, contextId);
            return readAll(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list context " + contextId + ": " + e.getMessage(), e);
        }
    }

    public AckOutcome acknowledge(String id, String acknowledgedBy, long nowMs) {
        String update = """
                UPDATE messages SET status=?,acknowledged_by=?,acknowledged_at_ms=?,updated_at_ms=?
                WHERE id=? AND status=?
                """;
        try (Connection c = database.openConnection()) {
            int changed;
            try (PreparedStatement ps = c.prepareStatement(update)) {
                ps.setString(1, MessageStatus.ACKNOWLEDGED.name());
                ps.setString(2, acknowledgedBy);
                ps.setLong(3, nowMs);
                ps.setLong(4, nowMs);
                ps.setString(5, id);
                ps.setString(6, MessageStatus.SENT.name());
                changed = ps.executeUpdate();
            }
            Message current = findById(c, id)
                    .orElseThrow(() -> new NotFoundException("Message not found: " + id));
            return new AckOutcome(current, changed > 0);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to acknowledge message " + id + ": " + e.getMessage(), e);
        }
    }

    public int countUnread(String recipient) {
        String sql = "SELECT COUNT(*) FROM messages WHERE recipient=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, recipient);
            ps.setString(2, MessageStatus.SENT.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count unread for " + recipient + ": " + e.getMessage(), e);
        }
    }

    public int deleteCreatedBefore(long cutoffMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM messages WHERE created_at_ms<?")) {
            ps.setLong(1, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to delete old messages: " + e.getMessage(), e);
        }
    }

    public StoreCounts counts() {
        String sql = """
                SELECT
                  (SELECT COUNT(*) FROM messages) AS total,
                  (SELECT COUNT(*) FROM messages WHERE status='SENT') AS unread,
                  (SELECT COUNT(*) FROM agents) AS agents
                """;
        try (Connection c = database.openConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            if (!rs.next()) {
                return new StoreCounts(0L, 0L, 0L);
            }
            return new StoreCounts(rs.getLong("total"), rs.getLong("unread"), rs.getLong("agents"));
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count messages: " + e.getMessage(), e);
        }
    }

    public AgentRegistration upsertAgent(String agentId, Map<String, Object> metadata, long nowMs) {
        String sql = """
                INSERT INTO agents(agent_id,metadata,registered_at_ms,last_seen_at_ms) VALUES(?,?,?,?)
                ON CONFLICT(agent_id) DO UPDATE SET metadata=excluded.metadata,last_seen_at_ms=excluded.last_seen_at_ms
                """;
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, agentId);
                ps.setString(2, Jsons.toCompactJson(metadata == null ? Map.of() : metadata));
                ps.setLong(3, nowMs);
                ps.setLong(4, nowMs);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT agent_id,metadata,registered_at_ms,last_seen_at_ms FROM agents WHERE agent_id=?")) {
                ps.setString(1, agentId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new IllegalStateException("Registered agent not readable: " + agentId);
                    }
                    return readAgent(rs);
                }
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to register agent " + agentId + ": " + e.getMessage(), e);
        }
    }

    public List<AgentRegistration> listAgents() {
        String sql = "SELECT agent_id,metadata,registered_at_ms,last_seen_at_ms FROM agents ORDER BY agent_id";
        List<AgentRegistration> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readAgent(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list agents: " + e.getMessage(), e);
        }
    }

    private Optional<Message> findById(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM messages WHERE id=?")) {
            ps.setString(1, id);
            List<Message> rows = readAll(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private void bind(PreparedStatement ps, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            Object value = args.get(i);
            if (value instanceof Long l) {
                ps.setLong(i + 1, l);
            } else if (value instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else {
                ps.setString(i + 1, String.valueOf(value));
            }
        }
    }

    private List<Message> readAll(PreparedStatement ps) throws SQLException {
        List<Message> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readMessage(rs));
            }
        }
        return out;
    }

    private Message readMessage(ResultSet rs) throws SQLException {
        long ackAt = rs.getLong("acknowledged_at_ms");
        Long acknowledgedAt = rs.wasNull() ? null : ackAt;
        return new Message(
                rs.getString("id"),
                rs.getLong("seq"),
                rs.getString("sender"),
                rs.getString("recipient"),
                MessageType.valueOf(rs.getString("type")),
                Jsons.toMap(rs.getString("payload")),
                rs.getString("context_id"),
                MessageStatus.valueOf(rs.getString("status")),
                rs.getLong("created_at_ms"),
                rs.getString("acknowledged_by"),
                acknowledgedAt,
                rs.getLong("updated_at_ms")
        );
    }

    private AgentRegistration readAgent(ResultSet rs) throws SQLException {
        return new AgentRegistration(
                rs.getString("agent_id"),
                Jsons.toMap(rs.getString("metadata")),
                rs.getLong("registered_at_ms"),
                rs.getLong("last_seen_at_ms")
        );
    }

    public record NewMessage(
            String id,
            String sender,
            String recipient,
            MessageType type,
            Map<String, Object> payload,
            String contextId,
            long nowMs
    ) {
    }

    public record AckOutcome(Message message, boolean transitioned) {
    }

    public record StoreCounts(long messages, long unread, long agents) {
    }
}
