package com.blissfly.proxy.core.exceptions;

/**
 * Raised at startup when the YAML configuration or a command-line override is unusable.
 */
public class ConfigException extends ProxyException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
