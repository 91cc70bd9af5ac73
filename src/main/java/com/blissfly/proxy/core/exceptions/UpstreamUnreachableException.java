package com.blissfly.proxy.core.exceptions;

/**
 * The target could not be reached after every retry attempt was spent.
 * Answered with {@code 503 Service Unavailable} and a {@code Retry-After} hint.
 */
public class UpstreamUnreachableException extends UpstreamException {
    public UpstreamUnreachableException(String message) {
        super(message, true);
    }

    public UpstreamUnreachableException(String message, Throwable cause) {
        super(message, true, cause);
    }
}
