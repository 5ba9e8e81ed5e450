package io.hivememory.coordination;

import io.hivememory.core.Expiry;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.SchemaTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only audit log in {@code events}. Appending never fails the caller.
 */
@Component
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);
    public static final long EVENT_TTL_SECONDS = Duration.ofDays(30).toSeconds();
    private static final String COLUMNS = "id, type, payload, source, timestamp, expires_at";

    private final MemoryContext context;

    public EventLog(MemoryContext context) {
        this.context = context;
    }

    /**
     * Appends an event.
     *
     * @return the stored event, or empty if it could not be written
     */
    public Optional<MemoryEvent> append(String type, Object payload, String source) {
        try {
            context.database().ensureTable(SchemaTable.EVENTS);
            long now = context.now();
            var event = new MemoryEvent(UUID.randomUUID().toString(), type, context.toTree(payload),
                    source, now, Expiry.expiresAt(now, EVENT_TTL_SECONDS));
            String json = context.toJson(event.payload());
            context.database().write(conn -> {
                try (var stmt = conn.prepareStatement("INSERT INTO events (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)")) {
                    stmt.setString(1, event.id());
                    stmt.setString(2, type);
                    stmt.setString(3, json);
                    stmt.setString(4, source);
                    stmt.setLong(5, event.timestamp());
                    stmt.setLong(6, event.expiresAt());
                    return stmt.executeUpdate();
                }
            });
            return Optional.of(event);
        } catch (RuntimeException e) {
            log.warn("Dropped event {} from {}: {}", type, source, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Live events of {@code type} with {@code from <= timestamp < to}, oldest first.
     */
    public List<MemoryEvent> queryByType(String type, long from, long to) {
        context.database().ensureTable(SchemaTable.EVENTS);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM events"
                    + " WHERE type = ? AND timestamp >= ? AND timestamp < ? AND " + Expiry.LIVE
                    + " ORDER BY timestamp, id")) {
                stmt.setString(1, type);
                stmt.setLong(2, from);
                stmt.setLong(3, to);
                stmt.setLong(4, context.now());
                return readEvents(stmt.executeQuery());
            }
        });
    }

    public List<MemoryEvent> queryBySource(String source) {
        context.database().ensureTable(SchemaTable.EVENTS);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM events"
                    + " WHERE source = ? AND " + Expiry.LIVE + " ORDER BY timestamp, id")) {
                stmt.setString(1, source);
                stmt.setLong(2, context.now());
                return readEvents(stmt.executeQuery());
            }
        });
    }

    private List<MemoryEvent> readEvents(ResultSet rs) throws SQLException {
        List<MemoryEvent> events = new ArrayList<>();
        try (rs) {
            while (rs.next()) {
                events.add(new MemoryEvent(
                        rs.getString("id"),
                        rs.getString("type"),
                        context.readJson(rs.getString("payload")),
                        rs.getString("source"),
                        rs.getLong("timestamp"),
                        rs.getLong("expires_at")));
            }
        }
        return events;
    }
}
