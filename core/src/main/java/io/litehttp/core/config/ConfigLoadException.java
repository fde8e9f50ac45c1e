package io.litehttp.core.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML,
 * unreadable certificate, or a value the configuration builder rejects.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
