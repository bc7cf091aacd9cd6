package io.lunacore.ledger;

/**
 * One turn to append; {@code latencies} may be null for none.
 */
public record TurnEntry(TurnRole role, String text, TurnLatencies latencies) {}
