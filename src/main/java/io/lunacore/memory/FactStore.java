package io.lunacore.memory;

import java.util.List;

/**
 * Durable key/value memories for the assistant.
 *
 * <p>Pinned memories are trusted, permanent facts injected into every prompt. Non-pinned memories
 * are transient and bounded by a capacity cap; the oldest are evicted first. There is at most one
 * row per (key, pinned) pair.</p>
 *
 * <p>All methods throw {@link io.lunacore.core.InvalidInputException} for malformed arguments and
 * {@link io.lunacore.core.StorageException} when the underlying storage fails.</p>
 */
public interface FactStore {

    /**
     * Inserts or overwrites the (key, pinned) row. Non-pinned writes are followed by cap enforcement.
     *
     * @param key    fact label, must not be empty
     * @param value  fact content, must not be empty
     * @param score  non-negative ranking hint
     * @param pinned whether the fact is pinned
     */
    void upsert(String key, String value, double score, boolean pinned);

    /**
     * Upserts a non-pinned fact, then enforces the configured cap before returning.
     */
    void addNonPinned(String key, String value, double score);

    /**
     * Shorthand for a pinned {@link #upsert}.
     */
    default void pin(String key, String value, double score) {
        upsert(key, value, score, true);
    }

    /**
     * Applies all writes in one transaction. Every write is validated before anything is stored.
     *
     * @return number of writes applied
     */
    int upsertBatch(List<MemoryWrite> writes);

    /**
     * Returns up to {@code limit} pinned memories, oldest first. Served from a TTL cache that every
     * write invalidates.
     */
    List<MemoryEntry> getPinned(int limit);

    /**
     * Lists all memories: pinned first, then by score, then newest first.
     */
    List<MemoryEntry> list(int limit);

    /**
     * Deletes the oldest non-pinned memories beyond {@code maxCount}. Pinned memories are never touched.
     *
     * @return number of memories evicted
     */
    int enforceNonPinnedCap(int maxCount);

    /**
     * Removes the pinned row for {@code key}.
     *
     * @return true if a pinned row existed
     */
    boolean unpin(String key);

    /**
     * Removes both the pinned and the non-pinned row for {@code key}.
     *
     * @return number of rows removed
     */
    int forget(String key);

    int count();

    int countNonPinned();

    /**
     * Removes every memory, pinned or not. Turns and sessions are kept.
     *
     * @return number of rows removed
     */
    int deleteMemories();

    /**
     * Irreversibly clears memories, turns and sessions.
     */
    void deleteAll();
}
