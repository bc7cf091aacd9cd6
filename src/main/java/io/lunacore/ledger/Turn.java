package io.lunacore.ledger;

import java.time.Instant;

/**
 * One immutable entry of the conversation log.
 */
public record Turn(
        long id,
        String sessionId,
        TurnRole role,
        String text,
        TurnLatencies latencies,
        Instant createdAt
) {}
