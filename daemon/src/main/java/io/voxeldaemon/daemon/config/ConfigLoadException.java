package io.voxeldaemon.daemon.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, an
 * unparseable environment override or a value out of range. The message names
 * the offending key and is suitable for startup error output.
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
