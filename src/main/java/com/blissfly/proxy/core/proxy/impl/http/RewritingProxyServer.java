package com.blissfly.proxy.core.proxy.impl.http;

import java.io.BufferedInputStream;
import java.io.FilterInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

import com.blissfly.proxy.config.BlissflyProperties;
import com.blissfly.proxy.core.codec.UrlCodec;
import com.blissfly.proxy.core.constants.HeaderConstants;
import com.blissfly.proxy.core.engine.ProxyEngine;
import com.blissfly.proxy.core.engine.TransformedResponse;
import com.blissfly.proxy.core.exceptions.InvalidTokenException;
import com.blissfly.proxy.core.exceptions.ProtocolException;
import com.blissfly.proxy.core.exceptions.ProxyException;
import com.blissfly.proxy.core.exceptions.UpstreamException;
import com.blissfly.proxy.core.exceptions.UpstreamUnreachableException;
import com.blissfly.proxy.core.proxy.AbstractProxyServer;
import com.blissfly.proxy.core.proxy.impl.http.filters.HttpFilter;
import com.blissfly.proxy.core.proxy.impl.http.filters.LoggingFilter;
import com.blissfly.proxy.core.proxy.impl.http.filters.RequestContext;
import com.blissfly.proxy.core.services.AccessLogService;
import com.blissfly.proxy.core.session.SessionEndpoint;
import com.blissfly.proxy.core.utils.IoUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.jsoup.nodes.Entities;

/**
 * Inbound HTTP/1.1 server of the rewriting proxy.
 * <p>
 * Serves {@code /watch} (proxied resources), {@code /search} (URL to proxy path) and
 * hands WebSocket upgrades on {@code /tunnel/<token>} and the session path to the
 * engine. Connections are kept alive between requests unless either side opts out.
 */
public class RewritingProxyServer extends AbstractProxyServer {

    /** Path answering {@code {"url": ...}} with the proxy path of the URL. */
    public static final String SEARCH_PATH = "/search";

    /** Seconds suggested to clients in {@code Retry-After} when the upstream is unreachable. */
    static final int RETRY_AFTER_SECONDS = 5;

    private static final int HTTP_OK = 200;
    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_METHOD_NOT_ALLOWED = 405;
    private static final int HTTP_PAYLOAD_TOO_LARGE = 413;
    private static final int HTTP_INTERNAL_ERROR = 500;
    private static final int HTTP_NOT_IMPLEMENTED = 501;
    private static final int HTTP_BAD_GATEWAY = 502;
    private static final int HTTP_SERVICE_UNAVAILABLE = 503;

    private static final String JSON_TYPE = "application/json";
    private static final String HTML_TYPE = "text/html; charset=utf-8";

    /** Standard HTTP reason phrases. */
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(101, "Switching Protocols"),
            Map.entry(200, "OK"), Map.entry(201, "Created"),
            Map.entry(204, "No Content"), Map.entry(301, "Moved Permanently"),
            Map.entry(302, "Found"), Map.entry(304, "Not Modified"),
            Map.entry(400, "Bad Request"), Map.entry(401, "Unauthorized"),
            Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"), Map.entry(408, "Request Timeout"),
            Map.entry(410, "Gone"), Map.entry(413, "Payload Too Large"),
            Map.entry(426, "Upgrade Required"), Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"), Map.entry(501, "Not Implemented"),
            Map.entry(502, "Bad Gateway"), Map.entry(503, "Service Unavailable"),
            Map.entry(504, "Gateway Timeout"));

    private final ProxyEngine engine;
    private final List<HttpFilter> filters;
    private final boolean debug;
    private final String sessionPath;
    private final Counter requestsTotal;
    private final Counter bytesSent;

    /**
     * @param properties       Application configuration.
     * @param engine           The rewriting proxy core.
     * @param accessLogService Access log writer.
     * @param registry         The Micrometer meter registry.
     */
    public RewritingProxyServer(BlissflyProperties properties, ProxyEngine engine,
            AccessLogService accessLogService, MeterRegistry registry) {
        super(properties.getServer(), registry);
        this.engine = engine;
        this.filters = List.of(new LoggingFilter(accessLogService));
        this.debug = properties.isDebug();
        this.sessionPath = properties.getSession().getPath();

        this.requestsTotal = Counter.builder("proxy.http.requests.total")
                .description("Total number of HTTP requests")
                .register(registry);
        this.bytesSent = Counter.builder("proxy.http.bytes.sent")
                .description("Total response body bytes sent to clients")
                .register(registry);
    }

    @Override
    public void stop() {
        super.stop();
        registry.remove(requestsTotal);
        registry.remove(bytesSent);
    }

    @Override
    protected String getProxyName() {
        return "Blissfly HTTP";
    }

    @Override
    protected void handleClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try (client) {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = client.getOutputStream();

            while (!client.isClosed() && processNextRequest(client, in, out, remoteAddr)) {
                // keep-alive: serve the next request on the same connection
            }
        } catch (ProtocolException e) {
            log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
        } catch (ProxyException e) {
            log.error("HTTP proxy error for {}: {}", remoteAddr, e.getMessage());
        } catch (Exception e) {
            log.debug("Unexpected HTTP client error from {}: {}", remoteAddr, e.getMessage());
        }
    }

    private boolean processNextRequest(Socket client, InputStream in, OutputStream out, String remoteAddr)
            throws IOException {
        String firstLine = readRequestLine(in, remoteAddr);
        if (firstLine == null) {
            return false;
        }
        requestsTotal.increment();

        Map<String, String> headers;
        try {
            headers = IoUtils.readHeaders(in);
        } catch (ProtocolException e) {
            log.warn("Rejecting request from {}: {}", remoteAddr, e.getMessage());
            writeErrorResponse(out, HTTP_BAD_REQUEST);
            return false;
        }

        String[] parts = firstLine.split(" ");
        if (parts.length < 2) {
            writeErrorResponse(out, HTTP_BAD_REQUEST);
            return false;
        }
        String method = parts[0].toUpperCase(Locale.ROOT);
        URI uri = parseUri(parts[1], out);
        if (uri == null) {
            return false;
        }

        RequestContext context = new RequestContext(method, uri, headers, remoteAddr);
        if (!executeFilters(context, out)) {
            return false;
        }

        if ("websocket".equalsIgnoreCase(headers.get(HeaderConstants.UPGRADE.getValue()))) {
            int status = handleUpgrade(client, context, in, out);
            postHandle(context, status);
            return false;
        }

        if (headers.containsKey(HeaderConstants.TRANSFER_ENCODING.getValue())) {
            writeErrorResponse(out, HTTP_NOT_IMPLEMENTED);
            postHandle(context, HTTP_NOT_IMPLEMENTED);
            return false;
        }
        long contentLength;
        try {
            contentLength = parseContentLength(headers);
        } catch (NumberFormatException e) {
            writeErrorResponse(out, HTTP_BAD_REQUEST);
            postHandle(context, HTTP_BAD_REQUEST);
            return false;
        }
        if (contentLength > config.getMaxRequestBody()) {
            writeErrorResponse(out, HTTP_PAYLOAD_TOO_LARGE);
            postHandle(context, HTTP_PAYLOAD_TOO_LARGE);
            return false;
        }

        boolean keepAlive = config.isKeepAlive()
                && !"close".equalsIgnoreCase(headers.get(HeaderConstants.CONNECTION.getValue()));
        LimitInputStream bodyStream = new LimitInputStream(in, contentLength);
        int status;
        try {
            status = route(context, bodyStream, out, keepAlive);
        } finally {
            bodyStream.drain();
        }
        postHandle(context, status);
        return keepAlive;
    }

    private int route(RequestContext context, InputStream body, OutputStream out, boolean keepAlive)
            throws IOException {
        String path = context.getUri().getRawPath();
        String method = context.getMethod();
        boolean head = "HEAD".equals(method);
        String proxyOrigin = proxyOrigin(context);

        if (UrlCodec.WATCH_PATH.equals(path)) {
            if ("GET".equals(method) || head) {
                String target = context.getUri().toString();
                return serveResource(context, out, keepAlive, head, target,
                        () -> engine.resolveViaProxy(target, proxyOrigin));
            }
            if ("POST".equals(method)) {
                String target;
                try {
                    target = UrlCodec.normalizeTarget(urlFromBody(context, body.readAllBytes()));
                } catch (InvalidTokenException e) {
                    return writeErrorPage(context, out, e, keepAlive, UrlCodec.WATCH_PATH);
                }
                return serveResource(context, out, keepAlive, false, engine.encodeForProxy(target),
                        () -> engine.resolve(target, proxyOrigin));
            }
            return writeResponse(context, out, HTTP_METHOD_NOT_ALLOWED, null, Map.of(), new byte[0], keepAlive,
                    false);
        }
        if (SEARCH_PATH.equals(path)) {
            if (!"POST".equals(method)) {
                return writeResponse(context, out, HTTP_METHOD_NOT_ALLOWED, null, Map.of(), new byte[0], keepAlive,
                        false);
            }
            return handleSearch(context, body.readAllBytes(), out, keepAlive);
        }
        return writeResponse(context, out, HTTP_NOT_FOUND, null, Map.of(), new byte[0], keepAlive, head);
    }

    private int serveResource(RequestContext context, OutputStream out, boolean keepAlive, boolean head,
            String retryLink, Supplier<TransformedResponse> resolver) throws IOException {
        TransformedResponse response;
        try {
            response = resolver.get();
        } catch (RuntimeException e) {
            return writeErrorPage(context, out, e, keepAlive, retryLink);
        }

        String cacheStatus = response.cacheHit() ? "HIT" : "MISS";
        context.setCacheStatus(cacheStatus);
        Map<String, String> headers = new LinkedHashMap<>(response.headers());
        headers.put(HeaderConstants.X_CACHE.getValue(), cacheStatus);
        return writeResponse(context, out, response.status(), response.contentType(), headers, response.body(),
                keepAlive, head);
    }

    private int handleSearch(RequestContext context, byte[] body, OutputStream out, boolean keepAlive)
            throws IOException {
        ObjectNode reply = engine.getMapper().createObjectNode();
        int status;
        try {
            String url = urlFromBody(context, body);
            reply.put("url", engine.encodeForProxy(UrlCodec.normalizeTarget(url)));
            status = HTTP_OK;
        } catch (InvalidTokenException e) {
            reply.put("error", e.getMessage());
            status = HTTP_BAD_REQUEST;
        }
        byte[] json = engine.getMapper().writeValueAsBytes(reply);
        return writeResponse(context, out, status, JSON_TYPE, Map.of(), json, keepAlive, false);
    }

    /**
     * Extracts the target URL from a JSON {@code {"url": ...}} or form {@code url=...} body.
     */
    private String urlFromBody(RequestContext context, byte[] body) {
        String contentType = context.getHeaders().getOrDefault(HeaderConstants.CONTENT_TYPE.getValue(), "");
        String text = new String(body, StandardCharsets.UTF_8).trim();
        String url = null;
        if (contentType.toLowerCase(Locale.ROOT).contains("json") || text.startsWith("{")) {
            try {
                JsonNode node = engine.getMapper().readTree(text);
                if (node != null && node.path(UrlCodec.URL_PARAM).isTextual()) {
                    url = node.get(UrlCodec.URL_PARAM).asText();
                }
            } catch (JsonProcessingException e) {
                throw new InvalidTokenException("Malformed JSON body", e);
            }
        } else {
            for (String pair : text.split("&")) {
                int idx = pair.indexOf('=');
                if (idx > 0 && UrlCodec.URL_PARAM.equals(URLDecoder.decode(pair.substring(0, idx),
                        StandardCharsets.UTF_8))) {
                    url = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                    break;
                }
            }
        }
        if (url == null || url.isBlank()) {
            throw new InvalidTokenException("URL required");
        }
        return url;
    }

    private int handleUpgrade(Socket client, RequestContext context, InputStream in, OutputStream out)
            throws IOException {
        String path = context.getUri().getRawPath();
        if (path.startsWith(UrlCodec.TUNNEL_PREFIX)) {
            String token = path.substring(UrlCodec.TUNNEL_PREFIX.length());
            return engine.getTunnel().open(token, context.getHeaders(), client, in, out);
        }
        SessionEndpoint endpoint = engine.getSessionEndpoint();
        if (endpoint != null && path.equals(sessionPath)) {
            client.setSoTimeout(0);
            return endpoint.serve(context.getHeaders(), in, out, context.getRemoteAddr());
        }
        writeErrorResponse(out, HTTP_NOT_FOUND);
        return HTTP_NOT_FOUND;
    }

    /**
     * Maps a failure to a status code and answers with an HTML page whose retry link
     * repeats the request as a GET.
     */
    private int writeErrorPage(RequestContext context, OutputStream out, RuntimeException error, boolean keepAlive,
            String retryLink) throws IOException {
        int status = statusFor(error);
        if (debug || status == HTTP_INTERNAL_ERROR) {
            log.warn("Failed to serve {} {}", context.getMethod(), context.getUri(), error);
        } else {
            log.warn("Failed to serve {} {}: {}", context.getMethod(), context.getUri(), error.getMessage());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        if (status == HTTP_SERVICE_UNAVAILABLE) {
            headers.put(HeaderConstants.RETRY_AFTER.getValue(), String.valueOf(RETRY_AFTER_SECONDS));
        }
        String reason = REASON_PHRASES.getOrDefault(status, "Error");
        String message = error.getMessage() != null ? error.getMessage() : reason;
        String html = "<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>" + status + " " + reason
                + "</title></head><body><h1>" + status + " " + reason + "</h1><p>"
                + Entities.escape(message) + "</p><p><a href=\"" + Entities.escape(retryLink)
                + "\">Try again</a></p></body></html>";
        return writeResponse(context, out, status, HTML_TYPE, headers, html.getBytes(StandardCharsets.UTF_8),
                keepAlive, "HEAD".equals(context.getMethod()));
    }

    /**
     * @param error A failure raised while resolving a resource.
     * @return The status code reported to the client.
     */
    static int statusFor(RuntimeException error) {
        if (error instanceof InvalidTokenException) {
            return HTTP_BAD_REQUEST;
        }
        if (error instanceof UpstreamUnreachableException) {
            return HTTP_SERVICE_UNAVAILABLE;
        }
        if (error instanceof UpstreamException) {
            return HTTP_BAD_GATEWAY;
        }
        return HTTP_INTERNAL_ERROR;
    }

    private int writeResponse(RequestContext context, OutputStream out, int status, String contentType,
            Map<String, String> headers, byte[] body, boolean keepAlive, boolean head) throws IOException {
        Map<String, String> all = new LinkedHashMap<>();
        if (contentType != null) {
            all.put(HeaderConstants.CONTENT_TYPE.getValue(), contentType);
        }
        all.putAll(headers);
        all.put(HeaderConstants.CONTENT_LENGTH.getValue(), String.valueOf(body.length));
        all.put(HeaderConstants.CONNECTION.getValue(), keepAlive ? "keep-alive" : "close");
        IoUtils.writeHead(out, "HTTP/1.1 " + status + " " + REASON_PHRASES.getOrDefault(status, "Unknown"), all);

        CountingOutputStream countingOut = new CountingOutputStream(out);
        if (!head) {
            countingOut.write(body);
        }
        out.flush();
        context.setBytes(countingOut.getCount());
        bytesSent.increment(countingOut.getCount());
        return status;
    }

    /**
     * Public origin used for absolute rewritten references: the configured one, else
     * derived from the Host header.
     */
    private String proxyOrigin(RequestContext context) {
        if (config.getPublicOrigin() != null && !config.getPublicOrigin().isBlank()) {
            return config.getPublicOrigin();
        }
        String host = context.getHeaders().get(HeaderConstants.HOST.getValue());
        return host != null && !host.isBlank() ? "http://" + host : null;
    }

    private boolean executeFilters(RequestContext context, OutputStream out) throws IOException {
        for (HttpFilter filter : filters) {
            try {
                if (!filter.preHandle(context, out)) {
                    return false;
                }
            } catch (ProxyException e) {
                log.warn("Filter error: {}", e.getMessage());
                return false;
            }
        }
        return true;
    }

    private void postHandle(RequestContext context, int statusCode) {
        for (HttpFilter filter : filters) {
            filter.postHandle(context, statusCode);
        }
    }

    private String readRequestLine(InputStream in, String remoteAddr) {
        try {
            String line = IoUtils.readLine(in);
            if (line == null || line.isEmpty()) {
                return null;
            }
            return line;
        } catch (IOException | ProtocolException e) {
            log.debug("Error reading request line from {}: {}", remoteAddr, e.getMessage());
            return null;
        }
    }

    private URI parseUri(String target, OutputStream out) throws IOException {
        try {
            URI uri = new URI(target);
            if (uri.isAbsolute()) {
                // absolute-form request target: only the path and query are routed on
                String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
                uri = new URI(uri.getRawQuery() != null ? path + "?" + uri.getRawQuery() : path);
            }
            if (uri.getRawPath() == null || uri.getRawPath().isEmpty()) {
                throw new URISyntaxException(target, "Request target has no path");
            }
            return uri;
        } catch (URISyntaxException e) {
            log.debug("Invalid request target {}: {}", target, e.getMessage());
            writeErrorResponse(out, HTTP_BAD_REQUEST);
            return null;
        }
    }

    private static long parseContentLength(Map<String, String> headers) {
        String value = headers.get(HeaderConstants.CONTENT_LENGTH.getValue());
        if (value == null) {
            return 0;
        }
        long length = Long.parseLong(value.trim());
        if (length < 0) {
            throw new NumberFormatException("Negative Content-Length: " + value);
        }
        return length;
    }

    private void writeErrorResponse(OutputStream out, int status) throws IOException {
        String response = "HTTP/1.1 " + status + " " + REASON_PHRASES.getOrDefault(status, "Error") + "\r\n"
                + "Content-Length: 0\r\n"
                + "Connection: close\r\n\r\n";
        out.write(response.getBytes(StandardCharsets.US_ASCII));
        out.flush();
    }

    /**
     * Request body view stopping at Content-Length. Closing it leaves the connection
     * stream open for the next request.
     */
    private static class LimitInputStream extends FilterInputStream {
        private long left;

        LimitInputStream(InputStream in, long limit) {
            super(in);
            this.left = limit;
        }

        @Override
        public int read() throws IOException {
            if (left <= 0) {
                return -1;
            }
            int res = super.read();
            if (res != -1) {
                left--;
            }
            return res;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (left <= 0) {
                return -1;
            }
            int toRead = (int) Math.min(len, left);
            int res = super.read(b, off, toRead);
            if (res != -1) {
                left -= res;
            }
            return res;
        }

        @Override
        public void close() {
            // the underlying connection stays open
        }

        /**
         * Skips whatever the handler did not read, so the next request starts cleanly.
         */
        void drain() throws IOException {
            if (left > 0) {
                in.skipNBytes(left);
                left = 0;
            }
        }
    }

    /**
     * OutputStream that counts the number of bytes written.
     */
    private static class CountingOutputStream extends FilterOutputStream {
        private long count = 0;

        CountingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b) throws IOException {
            out.write(b);
            count += b.length;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }

        long getCount() {
            return count;
        }
    }
}
