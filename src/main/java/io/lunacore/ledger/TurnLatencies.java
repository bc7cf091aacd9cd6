package io.lunacore.ledger;

import io.lunacore.core.InvalidInputException;

/**
 * Per-stage latencies recorded with a turn, in milliseconds.
 */
public record TurnLatencies(long asrMs, long llmMs, long ttsMs) {

    public static final TurnLatencies NONE = new TurnLatencies(0, 0, 0);

    public TurnLatencies {
        if (asrMs < 0 || llmMs < 0 || ttsMs < 0) {
            throw new InvalidInputException("Latencies must not be negative");
        }
    }

    public long totalMs() {
        return asrMs + llmMs + ttsMs;
    }
}
