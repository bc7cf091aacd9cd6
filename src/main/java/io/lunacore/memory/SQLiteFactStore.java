package io.lunacore.memory;

import io.lunacore.core.InvalidInputException;
import io.lunacore.storage.LunaDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite-backed fact store with a read-through cache for pinned memories.
 */
public class SQLiteFactStore implements FactStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteFactStore.class);

    private static final String UPSERT_SQL = """
        INSERT INTO memories (key, value, score, pinned, created_at)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT(key, pinned) DO UPDATE SET
            value = excluded.value,
            score = excluded.score,
            created_at = excluded.created_at
        """;

    private static final String EVICT_SQL = """
        DELETE FROM memories
        WHERE pinned = 0
          AND id NOT IN (
            SELECT id FROM memories
            WHERE pinned = 0
            ORDER BY created_at DESC, id DESC
            LIMIT ?
          )
        """;

    private final LunaDatabase database;
    private final PinnedMemoryCache pinnedCache;
    private final Clock clock;
    private final int nonPinnedCap;

    public SQLiteFactStore(LunaDatabase database, PinnedMemoryCache pinnedCache, Clock clock, int nonPinnedCap) {
        if (nonPinnedCap < 0) {
            throw new IllegalArgumentException("Non-pinned cap must be zero or positive");
        }
        this.database = database;
        this.pinnedCache = pinnedCache;
        this.clock = clock;
        this.nonPinnedCap = nonPinnedCap;
    }

    @Override
    public void upsert(String key, String value, double score, boolean pinned) {
        MemoryWrite write = new MemoryWrite(key, value, score, pinned);
        long now = clock.millis();

        database.write(conn -> {
            upsertRow(conn, write, now);
            return null;
        }, pinnedCache::invalidate);
        log.debug("Upserted memory: key='{}', pinned={}", write.key(), pinned);

        if (!pinned) {
            // A failure here leaves the write in place; capacity converges on the next write.
            enforceNonPinnedCap(nonPinnedCap);
        }
    }

    @Override
    public void addNonPinned(String key, String value, double score) {
        upsert(key, value, score, false);
    }

    @Override
    public int upsertBatch(List<MemoryWrite> writes) {
        if (writes == null) {
            throw new InvalidInputException("'writes' must not be null");
        }
        for (MemoryWrite write : writes) {
            if (write == null) {
                throw new InvalidInputException("Batch contains a null write");
            }
        }
        if (writes.isEmpty()) {
            return 0;
        }

        long now = clock.millis();
        database.write(conn -> {
            try (var stmt = conn.prepareStatement(UPSERT_SQL)) {
                for (MemoryWrite write : writes) {
                    bindUpsert(stmt, write, now);
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            return null;
        }, pinnedCache::invalidate);
        log.debug("Upserted batch of {} memories", writes.size());

        if (writes.stream().anyMatch(w -> !w.pinned())) {
            enforceNonPinnedCap(nonPinnedCap);
        }
        return writes.size();
    }

    @Override
    public List<MemoryEntry> getPinned(int limit) {
        if (limit < 0) {
            throw new InvalidInputException("'limit' must be zero or positive, got " + limit);
        }
        List<MemoryEntry> pinned = pinnedCache.get().orElseGet(this::loadPinned);
        return pinned.size() <= limit ? pinned : pinned.subList(0, limit);
    }

    private List<MemoryEntry> loadPinned() {
        LoadedPinned loaded = database.read(conn -> {
            long generation = pinnedCache.generation();
            var sql = """
                SELECT key, value, score, pinned, created_at
                FROM memories
                WHERE pinned = 1
                ORDER BY created_at ASC, id ASC
                """;
            try (var stmt = conn.prepareStatement(sql);
                 var rs = stmt.executeQuery()) {
                return new LoadedPinned(toEntries(rs), generation);
            }
        });
        pinnedCache.put(loaded.rows(), loaded.generation());
        log.debug("Pinned memory cache refreshed: {} entries", loaded.rows().size());
        return List.copyOf(loaded.rows());
    }

    @Override
    public List<MemoryEntry> list(int limit) {
        if (limit < 0) {
            throw new InvalidInputException("'limit' must be zero or positive, got " + limit);
        }
        return database.read(conn -> {
            var sql = """
                SELECT key, value, score, pinned, created_at
                FROM memories
                ORDER BY pinned DESC, score DESC, created_at DESC, id DESC
                LIMIT ?
                """;
            try (var stmt = conn.prepareStatement(sql)) {
                stmt.setInt(1, limit);
                try (var rs = stmt.executeQuery()) {
                    return toEntries(rs);
                }
            }
        });
    }

    @Override
    public int enforceNonPinnedCap(int maxCount) {
        if (maxCount < 0) {
            throw new InvalidInputException("'maxCount' must be zero or positive, got " + maxCount);
        }
        int evicted = database.write(conn -> {
            try (var stmt = conn.prepareStatement(EVICT_SQL)) {
                stmt.setInt(1, maxCount);
                return stmt.executeUpdate();
            }
        }, pinnedCache::invalidate);
        if (evicted > 0) {
            log.debug("Evicted {} non-pinned memories beyond cap {}", evicted, maxCount);
        }
        return evicted;
    }

    @Override
    public boolean unpin(String key) {
        String cleanKey = InvalidInputException.requireText(key, "key");
        int deleted = database.write(conn -> {
            try (var stmt = conn.prepareStatement("DELETE FROM memories WHERE key = ? AND pinned = 1")) {
                stmt.setString(1, cleanKey);
                return stmt.executeUpdate();
            }
        }, pinnedCache::invalidate);
        return deleted > 0;
    }

    @Override
    public int forget(String key) {
        String cleanKey = InvalidInputException.requireText(key, "key");
        int deleted = database.write(conn -> {
            try (var stmt = conn.prepareStatement("DELETE FROM memories WHERE key = ?")) {
                stmt.setString(1, cleanKey);
                return stmt.executeUpdate();
            }
        }, pinnedCache::invalidate);
        if (deleted > 0) {
            log.debug("Forgot memory: key='{}' ({} rows)", cleanKey, deleted);
        }
        return deleted;
    }

    @Override
    public int count() {
        return countWhere("");
    }

    @Override
    public int countNonPinned() {
        return countWhere(" WHERE pinned = 0");
    }

    @Override
    public int deleteMemories() {
        int deleted = database.write(conn -> {
            try (var stmt = conn.createStatement()) {
                return stmt.executeUpdate("DELETE FROM memories");
            }
        }, pinnedCache::invalidate);
        log.info("Deleted {} memories", deleted);
        return deleted;
    }

    @Override
    public void deleteAll() {
        database.write(conn -> {
            try (var stmt = conn.createStatement()) {
                stmt.executeUpdate("DELETE FROM turns");
                stmt.executeUpdate("DELETE FROM sessions");
                stmt.executeUpdate("DELETE FROM memories");
            }
            return null;
        }, pinnedCache::invalidate);
        log.info("Deleted all memories, turns and sessions");
    }

    private int countWhere(String where) {
        return database.read(conn -> {
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT COUNT(*) FROM memories" + where)) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private void upsertRow(Connection conn, MemoryWrite write, long now) throws SQLException {
        try (var stmt = conn.prepareStatement(UPSERT_SQL)) {
            bindUpsert(stmt, write, now);
            stmt.executeUpdate();
        }
    }

    private void bindUpsert(PreparedStatement stmt, MemoryWrite write, long now) throws SQLException {
        stmt.setString(1, write.key());
        stmt.setString(2, write.value());
        stmt.setDouble(3, write.score());
        stmt.setInt(4, write.pinned() ? 1 : 0);
        stmt.setLong(5, now);
    }

    private List<MemoryEntry> toEntries(ResultSet rs) throws SQLException {
        List<MemoryEntry> entries = new ArrayList<>();
        while (rs.next()) {
            entries.add(new MemoryEntry(
                    rs.getString("key"),
                    rs.getString("value"),
                    rs.getDouble("score"),
                    rs.getInt("pinned") == 1,
                    Instant.ofEpochMilli(rs.getLong("created_at"))
            ));
        }
        return entries;
    }

    private record LoadedPinned(List<MemoryEntry> rows, long generation) {}
}
