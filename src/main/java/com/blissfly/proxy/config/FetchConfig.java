package com.blissfly.proxy.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Defaults applied to every outbound fetch unless a request overrides them.
 */
public class FetchConfig {
    /** Maximum redirect hops followed for one fetch. */
    private int maxRedirects = 10;

    /** Total attempts, including the first, on connection or timeout failures. */
    private int retryCount = 3;

    /** Per-attempt timeout in milliseconds. */
    private long timeout = 30_000;

    /** First backoff delay in milliseconds; doubled for every later attempt. */
    private long retryBaseDelay = 1_000;

    /** Extra headers added to the browser-like template (and overriding it). */
    private Map<String, String> headers = new LinkedHashMap<>();

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public void setMaxRedirects(int maxRedirects) {
        this.maxRedirects = maxRedirects;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public long getTimeout() {
        return timeout;
    }

    public void setTimeout(long timeout) {
        this.timeout = timeout;
    }

    public long getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(long retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Map<String, String> getHeaders() {
        return headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(headers);
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
    }
}
