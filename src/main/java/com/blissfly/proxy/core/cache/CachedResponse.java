package com.blissfly.proxy.core.cache;

import java.util.Map;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A decoded upstream response as held by the {@link ResponseCache}.
 *
 * @param status      HTTP status code.
 * @param contentType Declared content type, may be null.
 * @param headers     Response headers worth replaying to the client.
 * @param body        Decoded body bytes.
 */
@SuppressFBWarnings({ "EI_EXPOSE_REP", "EI_EXPOSE_REP2" })
public record CachedResponse(int status, String contentType, Map<String, String> headers, byte[] body) {

    public CachedResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }
}
