package io.lunacore.ledger;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A conversation session. Owns zero or more turns.
 */
public record Session(String id, Instant startedAt, Map<String, Object> metadata) {

    public Session {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
