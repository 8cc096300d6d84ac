package io.eventrelay.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.log.EventJournal;
import io.eventrelay.log.EventPatterns;
import io.eventrelay.model.Event;
import io.eventrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public final class SqliteEventJournal implements EventJournal {
    private final Database database;

    public SqliteEventJournal(Database database) {
        this.database = database;
    }

    @Override
    public void append(Event event) {
        String sql = """
                INSERT INTO events(sequence_no, name, namespace, origin, data, timestamp_ms)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, event.sequenceNo());
            ps.setString(2, event.name());
            ps.setString(3, event.namespace());
            ps.setString(4, event.origin());
            ps.setString(5, Jsons.toCompactJson(event.data()));
            ps.setLong(6, event.timestampMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to journal event #" + event.sequenceNo(), e);
        }
    }

    @Override
    public List<Event> loadRecent(int limit) {
        String sql = """
                SELECT sequence_no, name, origin, data, timestamp_ms
                FROM events
                ORDER BY sequence_no DESC
                LIMIT ?
                """;
        List<Event> out = new ArrayList<>();
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, Math.max(0, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapEvent(rs));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load journaled events", e);
        }
        Collections.reverse(out);
        return out;
    }

    @Override
    public long lastSequence() {
        String sql = """
                SELECT MAX(
                    COALESCE((SELECT MAX(sequence_no) FROM events), 0),
                    COALESCE((SELECT value FROM journal_meta WHERE key = 'high_water'), 0)
                )
                """;
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read last journaled sequence", e);
        }
    }

    @Override
    public void recordHighWater(long sequenceNo) {
        String sql = """
                INSERT INTO journal_meta(key, value) VALUES ('high_water', ?)
                ON CONFLICT(key) DO UPDATE SET value = MAX(value, excluded.value)
                """;
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, sequenceNo);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record high-water mark #" + sequenceNo, e);
        }
    }

    /** Offline history read used by the CLI; scans forward from the cursor. */
    public List<Event> read(Collection<String> patterns, long since, int limit) {
        Set<String> validPatterns = EventPatterns.normalize(patterns);
        int safeLimit = Math.max(1, limit);
        String sql = """
                SELECT sequence_no, name, origin, data, timestamp_ms
                FROM events
                WHERE sequence_no > ?
                ORDER BY sequence_no ASC
                LIMIT ?
                """;
        List<Event> out = new ArrayList<>();
        long cursor = since;
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            while (out.size() < safeLimit) {
                ps.setLong(1, cursor);
                ps.setInt(2, 500);
                int seen = 0;
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next() && out.size() < safeLimit) {
                        Event event = mapEvent(rs);
                        cursor = event.sequenceNo();
                        seen++;
                        if (EventPatterns.matchesAny(validPatterns, event.name())) {
                            out.add(event);
                        }
                    }
                }
                if (seen == 0) {
                    break;
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read journaled events", e);
        }
        return out;
    }

    private static Event mapEvent(ResultSet rs) throws SQLException {
        return new Event(
                rs.getLong("sequence_no"),
                rs.getString("name"),
                parseData(rs.getString("data")),
                Instant.ofEpochMilli(rs.getLong("timestamp_ms")),
                rs.getString("origin")
        );
    }

    private static ObjectNode parseData(String raw) {
        if (raw == null || raw.isBlank()) {
            return Jsons.object();
        }
        try {
            JsonNode node = Jsons.readTree(raw);
            return node instanceof ObjectNode ? (ObjectNode) node : Jsons.object();
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupt journaled event payload", e);
        }
    }
}
