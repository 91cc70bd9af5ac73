package com.blissfly.proxy.core.proxy.impl.http.filters;

import com.blissfly.proxy.core.services.AccessLogService;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class LoggingFilterTest {

    @Test
    void preHandle_passesThroughWithoutLogging() {
        AccessLogService accessLog = mock(AccessLogService.class);
        LoggingFilter filter = new LoggingFilter(accessLog);
        RequestContext context = new RequestContext("GET", URI.create("/watch?url=abc"), Map.of(), "10.0.0.1");

        assertThat(filter.preHandle(context, new ByteArrayOutputStream())).isTrue();
        verifyNoInteractions(accessLog);
    }

    @Test
    void postHandle_logsRequestOutcome() {
        AccessLogService accessLog = mock(AccessLogService.class);
        LoggingFilter filter = new LoggingFilter(accessLog);
        RequestContext context = new RequestContext("GET", URI.create("/watch?url=abc"), Map.of(), "10.0.0.1");
        context.setBytes(512);
        context.setCacheStatus("HIT");

        filter.postHandle(context, 200);

        verify(accessLog).logRequest("10.0.0.1", null, "GET", "/watch?url=abc", 200, 512L, "HIT");
    }

    @Test
    void postHandle_defaultsCacheStatusToNone() {
        AccessLogService accessLog = mock(AccessLogService.class);
        RequestContext context = new RequestContext("POST", URI.create("/search"), Map.of(), "10.0.0.2");

        new LoggingFilter(accessLog).postHandle(context, 400);

        verify(accessLog).logRequest("10.0.0.2", null, "POST", "/search", 400, 0L, RequestContext.CACHE_NONE);
    }
}
