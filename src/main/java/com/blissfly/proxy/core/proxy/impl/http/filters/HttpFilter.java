package com.blissfly.proxy.core.proxy.impl.http.filters;

import java.io.IOException;
import java.io.OutputStream;

import com.blissfly.proxy.core.exceptions.ProxyException;

/**
 * Hook around the handling of one inbound HTTP request.
 */
public interface HttpFilter {
    /**
     * Called before the request is routed.
     *
     * @param context   The request being handled.
     * @param clientOut Client output, for filters that answer the request themselves.
     * @return true to continue to the next filter, false to abort the request.
     * @throws IOException    if writing to the client fails.
     * @throws ProxyException if the filter rejects the request.
     */
    boolean preHandle(RequestContext context, OutputStream clientOut) throws IOException, ProxyException;

    /**
     * Called after the response has been written.
     *
     * @param context    The request that was handled.
     * @param statusCode Status sent to the client.
     */
    default void postHandle(RequestContext context, int statusCode) {
    }
}
