package io.lunacore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the Luna core.
 *
 * <p>Binds to {@code luna} in application.yml:</p>
 * <pre>
 * luna:
 *   storage:
 *     path: ./data/luna.db
 *   memory:
 *     pinned-cache-ttl: 15s
 *     non-pinned-cap: 500
 *     pinned-context-limit: 50
 *     seed-score: 3.0
 *     capture-enabled: false
 *   knowledge:
 *     chunk-chars: 1200
 *     top-k: 5
 *     min-score: 0.0
 *     k1: 1.5
 *     b: 0.75
 *     rebuild-on-startup: true
 *   assistant:
 *     system-prompt: You are Luna, a helpful voice assistant.
 * </pre>
 *
 * Missing sections and values fall back to the defaults above.
 */
@ConfigurationProperties(prefix = "luna")
public record LunaProperties(Storage storage, Memory memory, Knowledge knowledge, Assistant assistant) {

    public LunaProperties {
        if (storage == null) {
            storage = new Storage(null);
        }
        if (memory == null) {
            memory = new Memory(null, null, null, null, null);
        }
        if (knowledge == null) {
            knowledge = new Knowledge(null, null, null, null, null, null);
        }
        if (assistant == null) {
            assistant = new Assistant(null);
        }
    }

    /**
     * @param path SQLite database file
     */
    public record Storage(String path) {
        public Storage {
            if (path == null || path.isBlank()) {
                path = "./data/luna.db";
            }
        }
    }

    /**
     * @param pinnedCacheTtl     how long a pinned read may be served from cache; zero disables the cache
     * @param nonPinnedCap       maximum number of non-pinned memories kept
     * @param pinnedContextLimit pinned facts injected into each prompt
     * @param seedScore          trust score given to seeded pinned facts
     * @param captureEnabled     whether user utterances are run through the fact extractor
     */
    public record Memory(
            Duration pinnedCacheTtl,
            Integer nonPinnedCap,
            Integer pinnedContextLimit,
            Double seedScore,
            Boolean captureEnabled
    ) {
        public Memory {
            if (pinnedCacheTtl == null) pinnedCacheTtl = Duration.ofSeconds(15);
            if (nonPinnedCap == null) nonPinnedCap = 500;
            if (pinnedContextLimit == null) pinnedContextLimit = 50;
            if (seedScore == null) seedScore = 3.0;
            if (captureEnabled == null) captureEnabled = false;

            if (pinnedCacheTtl.isNegative()) {
                throw new IllegalArgumentException("luna.memory.pinned-cache-ttl must not be negative");
            }
            if (nonPinnedCap < 0) {
                throw new IllegalArgumentException("luna.memory.non-pinned-cap must not be negative");
            }
            if (pinnedContextLimit < 0) {
                throw new IllegalArgumentException("luna.memory.pinned-context-limit must not be negative");
            }
            if (seedScore < 0) {
                throw new IllegalArgumentException("luna.memory.seed-score must not be negative");
            }
        }
    }

    /**
     * @param chunkChars       chunk size bound in characters
     * @param topK             default number of retrieval results
     * @param minScore         default minimum retrieval score
     * @param k1               term-frequency saturation
     * @param b                document-length normalization, within [0, 1]
     * @param rebuildOnStartup build the index once the application is ready
     */
    public record Knowledge(
            Integer chunkChars,
            Integer topK,
            Double minScore,
            Double k1,
            Double b,
            Boolean rebuildOnStartup
    ) {
        public Knowledge {
            if (chunkChars == null) chunkChars = 1200;
            if (topK == null) topK = 5;
            if (minScore == null) minScore = 0.0;
            if (k1 == null) k1 = 1.5;
            if (b == null) b = 0.75;
            if (rebuildOnStartup == null) rebuildOnStartup = true;

            if (chunkChars < 1) {
                throw new IllegalArgumentException("luna.knowledge.chunk-chars must be positive");
            }
            if (topK < 0) {
                throw new IllegalArgumentException("luna.knowledge.top-k must not be negative");
            }
            if (k1 < 0) {
                throw new IllegalArgumentException("luna.knowledge.k1 must not be negative");
            }
            if (b < 0 || b > 1) {
                throw new IllegalArgumentException("luna.knowledge.b must be within [0, 1]");
            }
        }
    }

    public record Assistant(String systemPrompt) {
        public Assistant {
            if (systemPrompt == null) {
                systemPrompt = "You are Luna, a helpful voice assistant.";
            }
        }
    }
}
