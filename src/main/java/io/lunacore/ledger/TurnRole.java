package io.lunacore.ledger;

import io.lunacore.core.InvalidInputException;

import java.util.Locale;

public enum TurnRole {
    USER,
    ASSISTANT;

    public static TurnRole fromString(String s) {
        if (s == null || s.isBlank()) {
            throw new InvalidInputException("'role' must not be empty");
        }
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "user" -> USER;
            case "assistant" -> ASSISTANT;
            default -> throw new InvalidInputException("Unknown turn role: " + s);
        };
    }
}
