package com.blissfly.proxy.core.exceptions;

/**
 * A proxy token could not be turned back into an absolute http(s) URL.
 * Answered with {@code 400 Bad Request}.
 */
public class InvalidTokenException extends ProxyException {
    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
