package io.lunacore.core;

/**
 * The configured storage location cannot be used. Only raised at startup.
 */
public class StorageConfigurationException extends LunaException {

    public StorageConfigurationException(String message) {
        super(message);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
