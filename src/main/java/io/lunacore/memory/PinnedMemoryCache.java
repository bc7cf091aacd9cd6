package io.lunacore.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-through cache for the pinned memory set.
 *
 * <p>Entries expire after the configured TTL. Every write path calls {@link #invalidate()} while it
 * still holds the database writer lock; the generation counter makes sure a load that started before
 * such a write can never be published afterwards.</p>
 */
public class PinnedMemoryCache {

    private final Duration ttl;
    private final Clock clock;
    private final AtomicLong generation = new AtomicLong();

    private volatile Snapshot snapshot;

    public PinnedMemoryCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("Pinned cache TTL must be zero or positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached pinned set if it is still within the TTL and no write happened since it was loaded.
     */
    public Optional<List<MemoryEntry>> get() {
        Snapshot current = snapshot;
        if (current == null || current.generation() != generation.get()) {
            return Optional.empty();
        }
        if (Duration.between(current.refreshedAt(), clock.instant()).compareTo(ttl) > 0) {
            return Optional.empty();
        }
        return Optional.of(current.rows());
    }

    /** Generation to pass back to {@link #put}; read it under the same lock as the rows. */
    public long generation() {
        return generation.get();
    }

    /**
     * Publishes a freshly loaded pinned set. Ignored when a write invalidated the cache after the load.
     */
    public synchronized void put(List<MemoryEntry> rows, long loadedAtGeneration) {
        if (ttl.isZero() || loadedAtGeneration != generation.get()) {
            return;
        }
        snapshot = new Snapshot(List.copyOf(rows), clock.instant(), loadedAtGeneration);
    }

    public synchronized void invalidate() {
        generation.incrementAndGet();
        snapshot = null;
    }

    /** Time of the last successful refresh, empty when nothing is cached. */
    public Optional<Instant> lastRefresh() {
        Snapshot current = snapshot;
        return current == null ? Optional.empty() : Optional.of(current.refreshedAt());
    }

    public Duration ttl() {
        return ttl;
    }

    private record Snapshot(List<MemoryEntry> rows, Instant refreshedAt, long generation) {}
}
