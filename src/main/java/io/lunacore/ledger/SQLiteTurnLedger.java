package io.lunacore.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lunacore.core.InvalidInputException;
import io.lunacore.storage.LunaDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class SQLiteTurnLedger implements TurnLedger {

    private static final Logger log = LoggerFactory.getLogger(SQLiteTurnLedger.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final LunaDatabase database;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SQLiteTurnLedger(LunaDatabase database, ObjectMapper objectMapper, Clock clock) {
        this.database = database;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Session startSession(String sessionId, Map<String, Object> metadata) {
        String id = InvalidInputException.requireText(sessionId, "sessionId");
        String metadataJson = toJson(metadata);
        long now = clock.millis();

        database.write(conn -> {
            var sql = """
                INSERT INTO sessions (id, started_at, metadata) VALUES (?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET started_at = excluded.started_at, metadata = excluded.metadata
                """;
            try (var stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                stmt.setLong(2, now);
                stmt.setString(3, metadataJson);
                stmt.executeUpdate();
            }
            return null;
        });
        log.debug("Started session '{}'", id);
        return new Session(id, Instant.ofEpochMilli(now), metadata);
    }

    @Override
    public Session startSession(Map<String, Object> metadata) {
        return startSession(UUID.randomUUID().toString(), metadata);
    }

    @Override
    public Turn addTurn(String sessionId, TurnRole role, String text, TurnLatencies latencies) {
        return addTurns(sessionId, List.of(new TurnEntry(role, text, latencies))).get(0);
    }

    @Override
    public List<Turn> addTurns(String sessionId, List<TurnEntry> entries) {
        String id = InvalidInputException.requireText(sessionId, "sessionId");
        if (entries == null || entries.isEmpty()) {
            throw new InvalidInputException("'entries' must not be empty");
        }
        // Validate everything before opening the transaction
        for (TurnEntry entry : entries) {
            if (entry == null || entry.role() == null) {
                throw new InvalidInputException("'role' must not be null");
            }
            if (entry.text() == null) {
                throw new InvalidInputException("'text' must not be null");
            }
        }
        long now = clock.millis();

        return database.write(conn -> {
            ensureSession(conn, id, now);
            var sql = """
                INSERT INTO turns (session_id, role, text, asr_latency_ms, llm_latency_ms, tts_latency_ms, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
            List<Turn> appended = new ArrayList<>(entries.size());
            try (var stmt = conn.prepareStatement(sql);
                 var lastId = conn.prepareStatement("SELECT last_insert_rowid()")) {
                for (TurnEntry entry : entries) {
                    TurnLatencies timings = entry.latencies() != null ? entry.latencies() : TurnLatencies.NONE;
                    stmt.setString(1, id);
                    stmt.setString(2, entry.role().name());
                    stmt.setString(3, entry.text());
                    stmt.setLong(4, timings.asrMs());
                    stmt.setLong(5, timings.llmMs());
                    stmt.setLong(6, timings.ttsMs());
                    stmt.setLong(7, now);
                    stmt.executeUpdate();
                    long turnId;
                    try (var rs = lastId.executeQuery()) {
                        turnId = rs.next() ? rs.getLong(1) : -1L;
                    }
                    appended.add(new Turn(turnId, id, entry.role(), entry.text(), timings, Instant.ofEpochMilli(now)));
                }
            }
            return List.copyOf(appended);
        });
    }

    @Override
    public List<Turn> getSessionTurns(String sessionId) {
        String id = InvalidInputException.requireText(sessionId, "sessionId");
        return database.read(conn -> {
            var sql = """
                SELECT id, session_id, role, text, asr_latency_ms, llm_latency_ms, tts_latency_ms, created_at
                FROM turns
                WHERE session_id = ?
                ORDER BY id ASC
                """;
            try (var stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                try (var rs = stmt.executeQuery()) {
                    return toTurns(rs);
                }
            }
        });
    }

    @Override
    public List<Turn> getRecentTurns(String sessionId, int limit) {
        String id = InvalidInputException.requireText(sessionId, "sessionId");
        if (limit < 0) {
            throw new InvalidInputException("'limit' must be zero or positive, got " + limit);
        }
        List<Turn> newestFirst = database.read(conn -> {
            var sql = """
                SELECT id, session_id, role, text, asr_latency_ms, llm_latency_ms, tts_latency_ms, created_at
                FROM turns
                WHERE session_id = ?
                ORDER BY id DESC
                LIMIT ?
                """;
            try (var stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                stmt.setInt(2, limit);
                try (var rs = stmt.executeQuery()) {
                    return toTurns(rs);
                }
            }
        });
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    public List<Session> listSessions() {
        return database.read(conn -> {
            List<Session> sessions = new ArrayList<>();
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT id, started_at, metadata FROM sessions ORDER BY started_at, id")) {
                while (rs.next()) {
                    sessions.add(new Session(
                            rs.getString("id"),
                            Instant.ofEpochMilli(rs.getLong("started_at")),
                            fromJson(rs.getString("metadata"))
                    ));
                }
            }
            return sessions;
        });
    }

    private void ensureSession(Connection conn, String sessionId, long now) throws SQLException {
        try (var stmt = conn.prepareStatement(
                "INSERT OR IGNORE INTO sessions (id, started_at, metadata) VALUES (?, ?, '{}')")) {
            stmt.setString(1, sessionId);
            stmt.setLong(2, now);
            stmt.executeUpdate();
        }
    }

    private List<Turn> toTurns(ResultSet rs) throws SQLException {
        List<Turn> turns = new ArrayList<>();
        while (rs.next()) {
            turns.add(new Turn(
                    rs.getLong("id"),
                    rs.getString("session_id"),
                    TurnRole.valueOf(rs.getString("role")),
                    rs.getString("text"),
                    new TurnLatencies(
                            rs.getLong("asr_latency_ms"),
                            rs.getLong("llm_latency_ms"),
                            rs.getLong("tts_latency_ms")),
                    Instant.ofEpochMilli(rs.getLong("created_at"))
            ));
        }
        return turns;
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Session metadata is not serializable: " + e.getOriginalMessage());
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable session metadata: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
