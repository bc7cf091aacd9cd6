package io.lunacore.knowledge;

import java.time.Instant;

/**
 * Snapshot of the retrieval index state.
 *
 * @param built      whether any index has been published
 * @param stale      whether chunks were ingested after the published index was built
 * @param chunkCount number of chunks in the published index
 * @param builtAt    build time of the published index, null when not built
 */
public record IndexStatus(boolean built, boolean stale, int chunkCount, Instant builtAt) {}
