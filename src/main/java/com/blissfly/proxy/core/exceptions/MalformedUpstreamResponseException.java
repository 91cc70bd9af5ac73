package com.blissfly.proxy.core.exceptions;

/**
 * The target answered, but its response could not be decoded (corrupt compressed body,
 * unusable redirect location).
 */
public class MalformedUpstreamResponseException extends UpstreamUnreachableException {
    public MalformedUpstreamResponseException(String message) {
        super(message);
    }

    public MalformedUpstreamResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
