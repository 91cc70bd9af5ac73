package com.blissfly.proxy.core.proxy.impl.http.filters;

import java.net.URI;
import java.util.Collections;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Context for a single HTTP request passing through the filter chain.
 */
public class RequestContext {
    /** Cache status for requests that never reached the cache. */
    public static final String CACHE_NONE = "-";

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final String remoteAddr;
    private long bytes;
    private String cacheStatus = CACHE_NONE;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RequestContext(String method, URI uri, Map<String, String> headers, String remoteAddr) {
        this.method = method;
        this.uri = uri;
        this.headers = headers;
        this.remoteAddr = remoteAddr;
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return The request target as sent by the client, usually origin-relative.
     */
    public URI getUri() {
        return uri;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public String getRemoteAddr() {
        return remoteAddr;
    }

    public long getBytes() {
        return bytes;
    }

    public void setBytes(long bytes) {
        this.bytes = bytes;
    }

    /**
     * @return {@code HIT}, {@code MISS} or {@value #CACHE_NONE}.
     */
    public String getCacheStatus() {
        return cacheStatus;
    }

    public void setCacheStatus(String cacheStatus) {
        this.cacheStatus = cacheStatus;
    }
}
