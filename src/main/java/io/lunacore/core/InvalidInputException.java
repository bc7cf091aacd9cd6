package io.lunacore.core;

/**
 * Raised when a write or query is rejected before touching storage.
 * Nothing is persisted when this is thrown.
 */
public class InvalidInputException extends LunaException {

    public InvalidInputException(String message) {
        super(message);
    }

    public static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException("'" + name + "' must not be empty");
        }
        return value.trim();
    }
}
