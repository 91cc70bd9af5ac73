package com.blissfly.proxy.core.exceptions;

/**
 * Base class for failures talking to the target origin.
 */
public class UpstreamException extends ProxyException {
    private final boolean retryable;

    /**
     * Creates an upstream failure.
     *
     * @param message   the detail message.
     * @param retryable whether the client may reasonably try the same request again.
     */
    public UpstreamException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    /**
     * Creates an upstream failure wrapping its cause.
     *
     * @param message   the detail message.
     * @param retryable whether the client may reasonably try the same request again.
     * @param cause     the underlying failure.
     */
    public UpstreamException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * @return true if a later retry of the same request may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
