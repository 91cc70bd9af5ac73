package com.blissfly.proxy.core.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.blissfly.proxy.config.FetchConfig;
import com.blissfly.proxy.core.cache.CachedResponse;
import com.blissfly.proxy.core.cache.ResponseCache;
import com.blissfly.proxy.core.codec.UrlCodec;
import com.blissfly.proxy.core.constants.HeaderConstants;
import com.blissfly.proxy.core.exceptions.InvalidTokenException;
import com.blissfly.proxy.core.exceptions.MalformedUpstreamResponseException;
import com.blissfly.proxy.core.exceptions.UpstreamUnreachableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs outbound fetches on behalf of the proxy.
 * <p>
 * Redirects are followed by hand so every hop can be checked against the
 * {@link RedirectChain}. Connection and timeout failures are retried with exponential
 * backoff. Response bodies are content-decoded before they are returned or cached.
 * <p>
 * Instances are thread-safe; no lock is held while a request is in flight.
 */
public class FetchOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);

    /** Headers the JDK client manages itself and refuses to accept. */
    private static final Set<String> RESTRICTED_HEADERS;

    /** Response headers dropped because the body they describe was re-encoded. */
    private static final Set<String> ENTITY_HEADERS;

    static {
        Set<String> restricted = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        restricted.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.UPGRADE.getValue(),
                "Expect", "Keep-Alive"));
        RESTRICTED_HEADERS = Collections.unmodifiableSet(restricted);

        Set<String> entity = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        entity.addAll(List.of(
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue()));
        ENTITY_HEADERS = Collections.unmodifiableSet(entity);
    }

    private final FetchConfig config;
    private final ResponseCache cache;
    private final HttpClient httpClient;
    private final ExecutorService clientExecutor;
    private final Sleeper sleeper;

    /**
     * Creates an orchestrator with its own HTTP client.
     *
     * @param config Fetch defaults.
     * @param cache  Response cache, or null to disable caching.
     */
    public FetchOrchestrator(FetchConfig config, ResponseCache cache) {
        this.config = config;
        this.cache = cache;
        this.sleeper = Sleeper.SYSTEM;
        this.clientExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "fetch-client");
            t.setDaemon(true);
            return t;
        });
        this.httpClient = HttpClient.newBuilder()
                .executor(clientExecutor)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(config.getTimeout()))
                .build();
    }

    /**
     * Creates an orchestrator around a supplied client, mainly for tests.
     *
     * @param config     Fetch defaults.
     * @param cache      Response cache, or null to disable caching.
     * @param httpClient Client used for every attempt.
     * @param sleeper    Backoff strategy.
     */
    public FetchOrchestrator(FetchConfig config, ResponseCache cache, HttpClient httpClient, Sleeper sleeper) {
        this.config = config;
        this.cache = cache;
        this.httpClient = httpClient;
        this.clientExecutor = null;
        this.sleeper = sleeper;
    }

    /**
     * Starts a request builder seeded from the configured defaults.
     *
     * @param url Absolute target URL.
     * @return A builder ready for overrides.
     */
    public FetchRequest.Builder request(String url) {
        return FetchRequest.builder(url)
                .maxRedirects(config.getMaxRedirects())
                .retryCount(config.getRetryCount())
                .timeout(Duration.ofMillis(config.getTimeout()))
                .headers(config.getHeaders());
    }

    /**
     * Fetches a URL with the configured defaults.
     *
     * @param url Absolute http(s) URL.
     * @return The decoded final response.
     */
    public FetchResult fetch(String url) {
        return fetch(request(url).build());
    }

    /**
     * Fetches a resource, following redirects and retrying transient failures.
     *
     * @param request What to fetch.
     * @return The decoded final response.
     * @throws com.blissfly.proxy.core.exceptions.UpstreamException on any upstream failure.
     */
    public FetchResult fetch(FetchRequest request) {
        if (!UrlCodec.isProxyTarget(request.getUrl())) {
            throw new InvalidTokenException("Not an absolute http(s) URL: " + request.getUrl());
        }

        if (request.isCacheable() && cache != null) {
            Optional<CachedResponse> cached = cache.get(request.getUrl());
            if (cached.isPresent()) {
                CachedResponse hit = cached.get();
                log.debug("Cache hit for {}", request.getUrl());
                return new FetchResult(request.getUrl(), request.getUrl(), hit.status(), hit.contentType(),
                        hit.headers(), hit.body(), List.of(request.getUrl()), true);
            }
        }

        RedirectChain chain = new RedirectChain(request.getUrl(), request.getMaxRedirects());
        String currentUrl = request.getUrl();
        String method = request.getMethod();
        byte[] body = request.getBody();

        while (true) {
            HttpRequest httpRequest = buildRequest(currentUrl, method, body, request);
            HttpResponse<byte[]> response = sendWithRetry(httpRequest, request.getRetryCount());
            int status = response.statusCode();

            Optional<String> location = response.headers().firstValue(HeaderConstants.LOCATION.getValue());
            if (REDIRECT_STATUSES.contains(status) && location.isPresent()) {
                String next = resolveLocation(currentUrl, location.get());
                chain.follow(next);
                log.debug("Redirect {} {} -> {}", status, currentUrl, next);
                if (status != 307 && status != 308) {
                    method = "GET";
                    body = null;
                }
                currentUrl = next;
                continue;
            }

            return toResult(request, currentUrl, response, chain);
        }
    }

    /**
     * Releases the internal client executor, if this instance created one.
     */
    @Override
    public void close() {
        if (clientExecutor != null) {
            clientExecutor.shutdownNow();
        }
    }

    private FetchResult toResult(FetchRequest request, String finalUrl, HttpResponse<byte[]> response,
            RedirectChain chain) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        response.headers().map().forEach((name, values) -> {
            if (!name.startsWith(":") && !values.isEmpty() && !ENTITY_HEADERS.contains(name)) {
                headers.put(name, values.get(0));
            }
        });

        String encoding = headers.get(HeaderConstants.CONTENT_ENCODING.getValue());
        byte[] decoded = ContentDecoder.decode(response.body(), encoding);
        if (ContentDecoder.isSupported(encoding)) {
            headers.remove(HeaderConstants.CONTENT_ENCODING.getValue());
        }

        String contentType = headers.get(HeaderConstants.CONTENT_TYPE.getValue());
        int status = response.statusCode();

        if (status == 200 && request.isCacheable() && cache != null) {
            cache.set(finalUrl, new CachedResponse(status, contentType, headers, decoded));
        }
        return new FetchResult(request.getUrl(), finalUrl, status, contentType,
                Collections.unmodifiableMap(headers), decoded, chain.urls(), false);
    }

    private HttpRequest buildRequest(String url, String method, byte[] body, FetchRequest request) {
        URI uri = URI.create(url);
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(request.getTimeout())
                .method(method, publisher);

        BrowserHeaders.forTarget(uri, request.getHeaders()).forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name)) {
                builder.header(name, value);
            }
        });
        return builder.build();
    }

    private HttpResponse<byte[]> sendWithRetry(HttpRequest request, int attempts) {
        IOException lastError = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            } catch (IOException e) {
                lastError = e;
                log.debug("Attempt {}/{} for {} failed: {}", attempt + 1, attempts, request.uri(), e.toString());
                if (attempt + 1 < attempts) {
                    backoff(attempt, request.uri());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamUnreachableException("Interrupted while fetching " + request.uri(), e);
            }
        }
        String reason = lastError != null ? lastError.toString() : "unknown error";
        log.warn("Giving up on {} after {} attempts: {}", request.uri(), attempts, reason);
        throw new UpstreamUnreachableException(
                "Unable to reach " + request.uri() + " after " + attempts + " attempts: " + reason, lastError);
    }

    private void backoff(int attempt, URI uri) {
        long delay = config.getRetryBaseDelay() * (1L << Math.min(attempt, 20));
        try {
            sleeper.sleep(Duration.ofMillis(delay));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnreachableException("Interrupted while backing off for " + uri, e);
        }
    }

    private static String resolveLocation(String currentUrl, String location) {
        String resolved;
        try {
            resolved = URI.create(currentUrl).resolve(location.trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new MalformedUpstreamResponseException("Invalid redirect location: " + location, e);
        }
        if (!UrlCodec.isProxyTarget(resolved)) {
            throw new MalformedUpstreamResponseException(
                    "Redirect to unsupported location: " + location.toLowerCase(Locale.ROOT));
        }
        return resolved;
    }
}
