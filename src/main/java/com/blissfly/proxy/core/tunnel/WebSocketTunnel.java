package com.blissfly.proxy.core.tunnel;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;

import com.blissfly.proxy.core.codec.UrlCodec;
import com.blissfly.proxy.core.constants.HeaderConstants;
import com.blissfly.proxy.core.exceptions.InvalidTokenException;
import com.blissfly.proxy.core.fetch.BrowserHeaders;
import com.blissfly.proxy.core.utils.IoUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges a browser WebSocket upgrade at {@code /tunnel/<token>} to the decoded target.
 * <p>
 * The tunnel performs the upstream handshake itself, forwards the upstream answer to the
 * client and, once the upstream has switched protocols, relays raw bytes in both
 * directions without looking at frames. Either leg ending closes the other.
 */
public class WebSocketTunnel implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTunnel.class);

    /** Client handshake headers passed on to the target. */
    private static final List<HeaderConstants> FORWARDED_HEADERS = List.of(
            HeaderConstants.SEC_WEBSOCKET_KEY,
            HeaderConstants.SEC_WEBSOCKET_VERSION,
            HeaderConstants.SEC_WEBSOCKET_PROTOCOL,
            HeaderConstants.SEC_WEBSOCKET_EXTENSIONS);

    private final UrlCodec codec;
    private final int connectTimeout;
    private final ExecutorService relayExecutor;
    private final Set<TunnelSession> active = ConcurrentHashMap.newKeySet();
    private final Counter tunnelsTotal;
    private final Counter bytesSent;
    private final Counter bytesReceived;

    /**
     * @param codec          Codec decoding tunnel tokens.
     * @param connectTimeout Connect and handshake timeout in milliseconds.
     * @param registry       Registry for tunnel counters, may be null.
     */
    public WebSocketTunnel(UrlCodec codec, int connectTimeout, MeterRegistry registry) {
        this.codec = codec;
        this.connectTimeout = connectTimeout;
        AtomicInteger threadCounter = new AtomicInteger();
        this.relayExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tunnel-relay-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        if (registry != null) {
            this.tunnelsTotal = Counter.builder("proxy.tunnels.total")
                    .description("Total number of WebSocket tunnels opened")
                    .register(registry);
            this.bytesSent = Counter.builder("proxy.tunnel.bytes.sent")
                    .description("Bytes relayed from clients to tunnel targets")
                    .register(registry);
            this.bytesReceived = Counter.builder("proxy.tunnel.bytes.received")
                    .description("Bytes relayed from tunnel targets to clients")
                    .register(registry);
        } else {
            this.tunnelsTotal = null;
            this.bytesSent = null;
            this.bytesReceived = null;
        }
    }

    /**
     * Opens a tunnel for one upgrade request and blocks until it ends.
     *
     * @param token     Token taken from the request path.
     * @param headers   Request headers of the upgrade request.
     * @param client    Client socket.
     * @param clientIn  Client input, positioned after the request head.
     * @param clientOut Client output.
     * @return The status sent to the client: the upstream status, 400 or 502.
     * @throws IOException if an error answer cannot be written to the client.
     */
    public int open(String token, Map<String, String> headers, Socket client, InputStream clientIn,
            OutputStream clientOut) throws IOException {
        URI target;
        try {
            target = URI.create(codec.decodeTunnelTarget(token));
        } catch (InvalidTokenException e) {
            log.debug("Rejecting tunnel with invalid token: {}", e.getMessage());
            writeError(clientOut, 400, "Bad Request");
            return 400;
        }

        Socket upstream = null;
        InputStream upstreamIn;
        String statusLine;
        Map<String, String> upstreamHeaders;
        try {
            upstream = connect(target);
            upstreamIn = new BufferedInputStream(upstream.getInputStream());
            IoUtils.writeHead(upstream.getOutputStream(), "GET " + pathOf(target) + " HTTP/1.1",
                    handshakeHeaders(target, headers));
            statusLine = IoUtils.readLine(upstreamIn);
            if (statusLine == null) {
                throw new IOException("Target closed the connection during the handshake");
            }
            upstreamHeaders = IoUtils.readHeaders(upstreamIn);
        } catch (IOException | RuntimeException e) {
            log.warn("WebSocket tunnel to {} failed: {}", target, e.getMessage());
            IoUtils.closeQuietly(upstream, "tunnel outbound socket");
            writeError(clientOut, 502, "Bad Gateway");
            return 502;
        }

        TunnelSession session;
        boolean relaying = false;
        try {
            int status = parseStatus(statusLine);
            IoUtils.writeHead(clientOut, statusLine, upstreamHeaders);
            if (status != 101) {
                log.debug("Target {} refused the upgrade with {}", target, statusLine);
                return status;
            }

            upstream.setSoTimeout(0);
            client.setSoTimeout(0);
            session = new TunnelSession(target.toString(), client, upstream);
            active.add(session);
            relaying = true;
        } finally {
            if (!relaying) {
                IoUtils.closeQuietly(upstream, "tunnel outbound socket");
            }
        }
        if (tunnelsTotal != null) {
            tunnelsTotal.increment();
        }
        log.info("WebSocket Tunnel: {} opened", target);
        try {
            IoUtils.relay(clientIn, clientOut, upstreamIn, upstream.getOutputStream(), relayExecutor, bytesSent,
                    bytesReceived);
        } finally {
            active.remove(session);
            session.close();
            log.info("WebSocket Tunnel: {} closed", target);
        }
        return 101;
    }

    /**
     * @return Number of tunnels currently relaying.
     */
    public int activeCount() {
        return active.size();
    }

    /**
     * Closes every active tunnel.
     */
    public void closeAll() {
        for (TunnelSession session : active) {
            log.debug("Closing tunnel to {}", session.getTarget());
            session.close();
        }
        active.clear();
    }

    @Override
    public void close() {
        closeAll();
        relayExecutor.shutdownNow();
    }

    private Socket connect(URI target) throws IOException {
        String scheme = target.getScheme().toLowerCase(Locale.ROOT);
        boolean secure = "https".equals(scheme) || "wss".equals(scheme);
        String host = target.getHost();
        int port = target.getPort() != -1 ? target.getPort() : (secure ? 443 : 80);

        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), connectTimeout);
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(connectTimeout);
            if (!secure) {
                return socket;
            }
            SSLSocket ssl = (SSLSocket) ((SSLSocketFactory) SSLSocketFactory.getDefault())
                    .createSocket(socket, host, port, true);
            ssl.startHandshake();
            return ssl;
        } catch (IOException e) {
            IoUtils.closeQuietly(socket, "tunnel outbound socket");
            throw e;
        }
    }

    private static Map<String, String> handshakeHeaders(URI target, Map<String, String> clientHeaders) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HeaderConstants.HOST.getValue(), target.getRawAuthority());
        headers.put(HeaderConstants.UPGRADE.getValue(), "websocket");
        headers.put(HeaderConstants.CONNECTION.getValue(), "Upgrade");
        headers.put(HeaderConstants.ORIGIN.getValue(), BrowserHeaders.originOf(httpEquivalent(target)));
        headers.put(HeaderConstants.USER_AGENT.getValue(), BrowserHeaders.USER_AGENT);
        for (HeaderConstants header : FORWARDED_HEADERS) {
            String value = clientHeaders.get(header.getValue());
            if (value != null) {
                headers.put(header.getValue(), value);
            }
        }
        return headers;
    }

    /**
     * Maps ws and wss to http and https, so the Origin header names a web origin.
     */
    private static URI httpEquivalent(URI target) {
        String scheme = target.getScheme().toLowerCase(Locale.ROOT);
        if ("ws".equals(scheme) || "wss".equals(scheme)) {
            String http = "ws".equals(scheme) ? "http" : "https";
            return URI.create(http + target.toString().substring(scheme.length()));
        }
        return target;
    }

    private static String pathOf(URI target) {
        String path = target.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        return target.getRawQuery() != null ? path + "?" + target.getRawQuery() : path;
    }

    private static int parseStatus(String statusLine) {
        String[] parts = statusLine.split(" ", 3);
        try {
            return parts.length > 1 ? Integer.parseInt(parts[1]) : 502;
        } catch (NumberFormatException e) {
            return 502;
        }
    }

    private static void writeError(OutputStream out, int status, String message) throws IOException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HeaderConstants.CONTENT_LENGTH.getValue(), "0");
        headers.put(HeaderConstants.CONNECTION.getValue(), "close");
        IoUtils.writeHead(out, "HTTP/1.1 " + status + " " + message, headers);
    }
}
