package io.lunacore.capture;

/**
 * A fact proposed by an extractor.
 *
 * @param key        memory key
 * @param value      memory value
 * @param confidence extractor confidence, stored as the memory score
 */
public record CandidateFact(String key, String value, double confidence) {}
