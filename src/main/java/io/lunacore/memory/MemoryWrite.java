package io.lunacore.memory;

import io.lunacore.core.InvalidInputException;

/**
 * A validated write request for the fact store. Construction fails with
 * {@link InvalidInputException} for an empty key or value, or a negative or non-finite score.
 */
public record MemoryWrite(String key, String value, double score, boolean pinned) {

    public MemoryWrite {
        key = InvalidInputException.requireText(key, "key");
        value = InvalidInputException.requireText(value, "value");
        if (Double.isNaN(score) || Double.isInfinite(score) || score < 0) {
            throw new InvalidInputException("'score' must be a non-negative number, got " + score);
        }
    }

    public static MemoryWrite pinned(String key, String value, double score) {
        return new MemoryWrite(key, value, score, true);
    }

    public static MemoryWrite nonPinned(String key, String value, double score) {
        return new MemoryWrite(key, value, score, false);
    }
}
