package com.blissfly.proxy.core.engine;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.blissfly.proxy.config.BlissflyProperties;
import com.blissfly.proxy.core.cache.CacheStats;
import com.blissfly.proxy.core.cache.ResponseCache;
import com.blissfly.proxy.core.codec.UrlCodec;
import com.blissfly.proxy.core.exceptions.InvalidTokenException;
import com.blissfly.proxy.core.fetch.FetchOrchestrator;
import com.blissfly.proxy.core.fetch.FetchResult;
import com.blissfly.proxy.core.rewrite.ClientRuntimeShim;
import com.blissfly.proxy.core.rewrite.ContentRewriter;
import com.blissfly.proxy.core.rewrite.CssRewriter;
import com.blissfly.proxy.core.rewrite.HtmlRewriter;
import com.blissfly.proxy.core.rewrite.RewriteContext;
import com.blissfly.proxy.core.rewrite.RewrittenContent;
import com.blissfly.proxy.core.rewrite.ScriptRewriter;
import com.blissfly.proxy.core.rewrite.ScriptStrategy;
import com.blissfly.proxy.core.session.SessionEndpoint;
import com.blissfly.proxy.core.session.SessionManager;
import com.blissfly.proxy.core.tunnel.WebSocketTunnel;
import com.blissfly.proxy.core.utils.IoUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The rewriting proxy core.
 * <p>
 * Owns the codec, cache, fetch orchestrator, rewriters, session manager and tunnel, and
 * exposes the two operations the outer layers build on: turning a target URL into a
 * proxy path and turning a proxy path into a served response.
 */
public class ProxyEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProxyEngine.class);

    /** Upstream response headers passed on to the browser. */
    private static final List<String> PASSTHROUGH_HEADERS = List.of(
            "Cache-Control", "Expires", "Vary", "Last-Modified", "ETag", "Content-Language");

    private final UrlCodec codec;
    private final ResponseCache cache;
    private final FetchOrchestrator orchestrator;
    private final ContentRewriter rewriter;
    private final SessionManager sessionManager;
    private final SessionEndpoint sessionEndpoint;
    private final WebSocketTunnel tunnel;
    private final ObjectMapper mapper;

    /**
     * Builds the engine from configuration.
     *
     * @param properties Application configuration.
     * @param registry   Registry for engine meters, may be null.
     */
    public ProxyEngine(BlissflyProperties properties, MeterRegistry registry) {
        this(properties, registry, Clock.systemUTC());
    }

    /**
     * Builds the engine from configuration with an explicit clock.
     *
     * @param properties Application configuration.
     * @param registry   Registry for engine meters, may be null.
     * @param clock      Time source for the cache and sessions.
     */
    public ProxyEngine(BlissflyProperties properties, MeterRegistry registry, Clock clock) {
        this.mapper = new ObjectMapper();
        this.codec = new UrlCodec();

        if (properties.getCache().isEnabled()) {
            this.cache = new ResponseCache(properties.getCache(), clock);
            this.cache.startSweeper();
        } else {
            this.cache = null;
        }
        this.orchestrator = new FetchOrchestrator(properties.getFetch(), cache);

        ClientRuntimeShim shim = properties.getRewrite().isInjectShim() ? new ClientRuntimeShim(mapper) : null;
        CssRewriter css = new CssRewriter();
        ScriptRewriter script = new ScriptRewriter(
                ScriptStrategy.fromConfig(properties.getRewrite().getScriptStrategy()), shim);
        this.rewriter = new ContentRewriter(new HtmlRewriter(css, script, shim), css, script);

        this.sessionManager = new SessionManager(clock);
        this.sessionEndpoint = properties.getSession().isEnabled()
                ? new SessionEndpoint(sessionManager, mapper, clock, properties.getSession().getMaxMessageSize())
                : null;
        this.tunnel = new WebSocketTunnel(codec, properties.getServer().getTimeout(), registry);

        if (registry != null) {
            bindMetrics(registry);
        }
    }

    /**
     * Produces the proxy path for a target URL.
     *
     * @param url Absolute http(s) URL.
     * @return {@code /watch?url=<token>}.
     * @throws InvalidTokenException if the URL is not an absolute http(s) URL.
     */
    public String encodeForProxy(String url) {
        if (!UrlCodec.isProxyTarget(url)) {
            throw new InvalidTokenException("Not an absolute http(s) URL: " + url);
        }
        return codec.proxyPath(url);
    }

    /**
     * Resolves a proxy path such as {@code /watch?url=<token>}.
     *
     * @param pathAndQuery Raw request target.
     * @param proxyOrigin  Public origin of the proxy, may be null.
     * @return The response to serve.
     * @throws InvalidTokenException if the path carries no valid token.
     */
    public TransformedResponse resolveViaProxy(String pathAndQuery, String proxyOrigin) {
        URI uri;
        try {
            uri = URI.create(pathAndQuery);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Malformed proxy path: " + pathAndQuery, e);
        }
        if (!UrlCodec.WATCH_PATH.equals(uri.getRawPath())) {
            throw new InvalidTokenException("Not a proxy path: " + pathAndQuery);
        }
        String token = queryParameter(uri.getRawQuery(), UrlCodec.URL_PARAM);
        if (token == null) {
            throw new InvalidTokenException("Missing '" + UrlCodec.URL_PARAM + "' parameter");
        }
        return resolveToken(token, proxyOrigin);
    }

    /**
     * Decodes a token and resolves its target.
     *
     * @param token       Encoded target.
     * @param proxyOrigin Public origin of the proxy, may be null.
     * @return The response to serve.
     */
    public TransformedResponse resolveToken(String token, String proxyOrigin) {
        return resolve(codec.decode(token), proxyOrigin);
    }

    /**
     * Fetches a target and rewrites it for delivery through the proxy. Rewriting runs on
     * every call, since the output depends on the proxy origin; the cache holds the
     * decoded upstream response.
     *
     * @param url         Absolute http(s) URL.
     * @param proxyOrigin Public origin of the proxy, may be null.
     * @return The response to serve.
     */
    public TransformedResponse resolve(String url, String proxyOrigin) {
        FetchResult result = orchestrator.fetch(url);
        RewriteContext context = new RewriteContext(result.finalUrl(), proxyOrigin, codec);
        RewrittenContent content = rewriter.transform(result.body(), result.contentType(), context);

        Map<String, String> headers = new LinkedHashMap<>();
        result.headers().forEach((name, value) -> {
            for (String passthrough : PASSTHROUGH_HEADERS) {
                if (passthrough.equalsIgnoreCase(name) && value != null) {
                    headers.put(passthrough, value);
                }
            }
        });
        log.debug("Resolved {} -> {} ({}, {} bytes, cache {})", url, result.finalUrl(), result.status(),
                content.body() == null ? 0 : content.body().length, result.fromCache() ? "HIT" : "MISS");
        return new TransformedResponse(result.status(), content.contentType(), headers, content.body(),
                result.finalUrl(), result.fromCache());
    }

    /**
     * @return Cache counters, or null when caching is disabled.
     */
    public CacheStats cacheStats() {
        return cache != null ? cache.getStats() : null;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public SessionManager getSessionManager() {
        return sessionManager;
    }

    /**
     * @return The session endpoint, or null when sessions are disabled.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public SessionEndpoint getSessionEndpoint() {
        return sessionEndpoint;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public WebSocketTunnel getTunnel() {
        return tunnel;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * Closes tunnels, stops the cache sweep and releases the fetch client.
     */
    @Override
    public void close() {
        IoUtils.closeQuietly(tunnel, "tunnel");
        IoUtils.closeQuietly(cache, "response cache");
        IoUtils.closeQuietly(orchestrator, "fetch orchestrator");
    }

    private void bindMetrics(MeterRegistry registry) {
        Gauge.builder("proxy.sessions.active", sessionManager, SessionManager::sessionCount)
                .description("Current number of shared sessions")
                .register(registry);
        Gauge.builder("proxy.tunnels.active", tunnel, WebSocketTunnel::activeCount)
                .description("Current number of open WebSocket tunnels")
                .register(registry);
        if (cache == null) {
            return;
        }
        Gauge.builder("proxy.cache.size", cache, ResponseCache::size)
                .description("Live entries in the response cache")
                .register(registry);
        Gauge.builder("proxy.cache.memory", cache, ResponseCache::memoryBytes)
                .baseUnit("bytes")
                .description("Accounted size of the response cache")
                .register(registry);
        FunctionCounter.builder("proxy.cache.hits", cache, c -> c.getStats().hits())
                .description("Cache lookups served from the cache")
                .register(registry);
        FunctionCounter.builder("proxy.cache.misses", cache, c -> c.getStats().misses())
                .description("Cache lookups that found nothing live")
                .register(registry);
        FunctionCounter.builder("proxy.cache.evictions", cache, c -> c.getStats().evictions())
                .description("Cache entries removed by expiry, sweep or eviction")
                .register(registry);
    }

    private static String queryParameter(String rawQuery, String name) {
        if (rawQuery == null) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int idx = pair.indexOf('=');
            String key = idx >= 0 ? pair.substring(0, idx) : pair;
            if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                String value = idx >= 0 ? pair.substring(idx + 1) : "";
                return URLDecoder.decode(value, StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
