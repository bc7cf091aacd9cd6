package io.lunacore.ledger;

import java.util.List;
import java.util.Map;

/**
 * Append-only log of conversation turns grouped by session.
 * Turns are never modified; the only removal is a full reset through the fact store.
 */
public interface TurnLedger {

    /**
     * Creates or replaces a session row.
     */
    Session startSession(String sessionId, Map<String, Object> metadata);

    /**
     * Creates a session with a generated id.
     */
    Session startSession(Map<String, Object> metadata);

    /**
     * Appends one turn. The session is created on demand when it does not exist yet.
     */
    Turn addTurn(String sessionId, TurnRole role, String text, TurnLatencies latencies);

    /**
     * Appends several turns in one transaction: either all of them are stored, in order, or none.
     */
    List<Turn> addTurns(String sessionId, List<TurnEntry> entries);

    /**
     * All turns of a session in insertion order.
     */
    List<Turn> getSessionTurns(String sessionId);

    /**
     * The newest {@code limit} turns of a session, returned oldest first.
     */
    List<Turn> getRecentTurns(String sessionId, int limit);

    List<Session> listSessions();
}
