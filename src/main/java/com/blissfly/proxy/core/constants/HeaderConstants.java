package com.blissfly.proxy.core.constants;

/**
 * HTTP header names the proxy reads or writes.
 */
public enum HeaderConstants {
    /** The standard HTTP Host header. */
    HOST("Host"),
    /** Hop-by-hop Connection header. */
    CONNECTION("Connection"),
    /** Length of the entity body in bytes. */
    CONTENT_LENGTH("Content-Length"),
    /** Media type of the entity body. */
    CONTENT_TYPE("Content-Type"),
    /** Content codings applied to the entity body. */
    CONTENT_ENCODING("Content-Encoding"),
    /** Transfer coding of the message. */
    TRANSFER_ENCODING("Transfer-Encoding"),
    /** Redirect target. */
    LOCATION("Location"),
    /** Used by the client to request a protocol change. */
    UPGRADE("Upgrade"),
    /** Origin of the page issuing the request. */
    ORIGIN("Origin"),
    /** Referring page. */
    REFERER("Referer"),
    /** Client software identification. */
    USER_AGENT("User-Agent"),
    /** Hint sent with 503 answers. */
    RETRY_AFTER("Retry-After"),
    /** Whether the response was served from the response cache. */
    X_CACHE("X-Cache"),
    /** WebSocket handshake nonce. */
    SEC_WEBSOCKET_KEY("Sec-WebSocket-Key"),
    /** WebSocket handshake answer. */
    SEC_WEBSOCKET_ACCEPT("Sec-WebSocket-Accept"),
    /** WebSocket protocol version. */
    SEC_WEBSOCKET_VERSION("Sec-WebSocket-Version"),
    /** WebSocket sub-protocols offered by the client. */
    SEC_WEBSOCKET_PROTOCOL("Sec-WebSocket-Protocol"),
    /** WebSocket extensions offered by the client. */
    SEC_WEBSOCKET_EXTENSIONS("Sec-WebSocket-Extensions");

    private final String value;

    HeaderConstants(String value) {
        this.value = value;
    }

    /**
     * Retrieves the wire spelling of the header.
     *
     * @return The header name as sent on the wire.
     */
    public String getValue() {
        return value;
    }
}
