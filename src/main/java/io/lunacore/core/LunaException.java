package io.lunacore.core;

/**
 * Base type for every failure raised by the Luna core.
 * All subclasses are unchecked; callers decide whether to retry or degrade.
 */
public abstract class LunaException extends RuntimeException {

    protected LunaException(String message) {
        super(message);
    }

    protected LunaException(String message, Throwable cause) {
        super(message, cause);
    }
}
