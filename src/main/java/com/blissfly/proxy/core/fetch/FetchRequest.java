package com.blissfly.proxy.core.fetch;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Immutable description of one logical outbound fetch.
 * Obtain a builder from {@link FetchOrchestrator#request(String)} to start from the
 * configured defaults.
 */
public final class FetchRequest {
    /** Default hop limit. */
    public static final int DEFAULT_MAX_REDIRECTS = 10;
    /** Default total attempt count. */
    public static final int DEFAULT_RETRY_COUNT = 3;
    /** Default per-attempt timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String url;
    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final int maxRedirects;
    private final int retryCount;
    private final Duration timeout;
    private final boolean useCache;

    private FetchRequest(Builder builder) {
        this.url = builder.url;
        this.method = builder.method;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.maxRedirects = builder.maxRedirects;
        this.retryCount = builder.retryCount;
        this.timeout = builder.timeout;
        this.useCache = builder.useCache;
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public String getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return Per-call header overrides applied on top of the browser template.
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * @return true if this fetch may be answered from and stored into the cache.
     */
    public boolean isCacheable() {
        return useCache && "GET".equals(method);
    }

    /**
     * Fluent builder for {@link FetchRequest}.
     */
    public static final class Builder {
        private final String url;
        private String method = "GET";
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private int maxRedirects = DEFAULT_MAX_REDIRECTS;
        private int retryCount = DEFAULT_RETRY_COUNT;
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean useCache = true;

        private Builder(String url) {
            if (url == null) {
                throw new IllegalArgumentException("url must not be null");
            }
            this.url = url;
        }

        public Builder method(String method) {
            this.method = method.toUpperCase(Locale.ROOT);
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> values) {
            headers.putAll(values);
            return this;
        }

        @SuppressFBWarnings("EI_EXPOSE_REP2")
        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            this.maxRedirects = Math.max(0, maxRedirects);
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = Math.max(1, retryCount);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder useCache(boolean useCache) {
            this.useCache = useCache;
            return this;
        }

        public FetchRequest build() {
            return new FetchRequest(this);
        }
    }
}
