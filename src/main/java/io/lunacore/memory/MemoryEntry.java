package io.lunacore.memory;

import java.time.Instant;

/**
 * A stored key/value fact.
 *
 * @param key       fact label, unique together with {@code pinned}
 * @param value     fact content
 * @param score     non-negative ranking hint; never used for eviction order
 * @param pinned    pinned facts are trusted and exempt from eviction
 * @param createdAt time of the latest write to this row
 */
public record MemoryEntry(
        String key,
        String value,
        double score,
        boolean pinned,
        Instant createdAt
) {
    public String asLine() {
        return "%s: %s".formatted(key, value);
    }
}
