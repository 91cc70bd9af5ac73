package com.blissfly.proxy.core.fetch;

import java.util.List;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Outcome of a fetch: the final response with its body already content-decoded.
 *
 * @param requestedUrl  URL the fetch started from.
 * @param finalUrl      URL of the response after redirects; the base for rewriting.
 * @param status        HTTP status of the final response.
 * @param contentType   Declared content type, may be null.
 * @param headers       Final response headers (single-valued, without content coding).
 * @param body          Decoded body.
 * @param redirectChain Every URL visited, starting with {@code requestedUrl}.
 * @param fromCache     Whether the response came from the cache.
 */
@SuppressFBWarnings({ "EI_EXPOSE_REP", "EI_EXPOSE_REP2" })
public record FetchResult(String requestedUrl, String finalUrl, int status, String contentType,
        Map<String, String> headers, byte[] body, List<String> redirectChain, boolean fromCache) {
}
