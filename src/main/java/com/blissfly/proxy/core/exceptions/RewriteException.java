package com.blissfly.proxy.core.exceptions;

/**
 * One embedded URL could not be resolved or rewritten. The rewriters catch it and leave
 * that single occurrence untouched.
 */
public class RewriteException extends ProxyException {
    public RewriteException(String message) {
        super(message);
    }

    public RewriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
