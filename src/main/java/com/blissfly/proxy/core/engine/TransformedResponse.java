package com.blissfly.proxy.core.engine;

import java.util.Map;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A resource as it is served to the browser.
 *
 * @param status      Status of the final upstream response.
 * @param contentType Content type to announce, may be null.
 * @param headers     Upstream headers safe to pass on.
 * @param body        Response body, rewritten where its type allows.
 * @param finalUrl    URL the body was fetched from after redirects.
 * @param cacheHit    Whether the upstream response came from the cache.
 */
@SuppressFBWarnings({ "EI_EXPOSE_REP", "EI_EXPOSE_REP2" })
public record TransformedResponse(int status, String contentType, Map<String, String> headers, byte[] body,
        String finalUrl, boolean cacheHit) {

    public TransformedResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }
}
