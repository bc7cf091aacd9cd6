package io.lunacore.core;

/**
 * Underlying I/O, corruption or unexpected constraint failure in persistent storage.
 * Never retried inside the core.
 */
public class StorageException extends LunaException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
