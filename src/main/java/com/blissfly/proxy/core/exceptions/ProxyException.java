package com.blissfly.proxy.core.exceptions;

/**
 * Root of every failure raised by the proxy engine.
 * All subclasses are unchecked so they can cross the rewriting and fetch layers freely.
 */
public class ProxyException extends RuntimeException {
    /**
     * Creates a proxy failure with a message.
     *
     * @param message the detail message.
     */
    public ProxyException(String message) {
        super(message);
    }

    /**
     * Creates a proxy failure wrapping its cause.
     *
     * @param message the detail message.
     * @param cause   the underlying failure.
     */
    public ProxyException(String message, Throwable cause) {
        super(message, cause);
    }
}
