package com.blissfly.proxy.core.proxy.impl.http.filters;

import java.io.OutputStream;

import com.blissfly.proxy.core.services.AccessLogService;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Filter that writes one access log line per handled request.
 */
public class LoggingFilter implements HttpFilter {
    private final AccessLogService accessLogService;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public LoggingFilter(AccessLogService accessLogService) {
        this.accessLogService = accessLogService;
    }

    @Override
    public boolean preHandle(RequestContext context, OutputStream clientOut) {
        return true;
    }

    @Override
    public void postHandle(RequestContext context, int statusCode) {
        accessLogService.logRequest(
                context.getRemoteAddr(),
                null,
                context.getMethod(),
                context.getUri().toString(),
                statusCode,
                context.getBytes(),
                context.getCacheStatus());
    }
}
