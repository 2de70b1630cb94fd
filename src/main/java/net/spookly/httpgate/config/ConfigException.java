package net.spookly.httpgate.config;

/**
 * Raised when the gateway configuration cannot be read or is invalid. Fatal at startup.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
