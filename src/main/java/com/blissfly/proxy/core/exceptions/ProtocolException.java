package com.blissfly.proxy.core.exceptions;

/**
 * Malformed inbound traffic: a broken HTTP request line, too many headers or an
 * invalid WebSocket frame. The connection that produced it is closed.
 */
public class ProtocolException extends ProxyException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
