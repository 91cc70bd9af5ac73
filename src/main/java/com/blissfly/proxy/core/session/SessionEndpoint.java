package com.blissfly.proxy.core.session;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.blissfly.proxy.core.constants.HeaderConstants;
import com.blissfly.proxy.core.exceptions.ProtocolException;
import com.blissfly.proxy.core.utils.IoUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket endpoint serving the shared session sub-protocol.
 * <p>
 * Performs the server side of the RFC 6455 handshake on an already parsed upgrade
 * request, then reads frames until the client closes. Text messages (possibly
 * fragmented) go to a {@link SessionProtocolHandler}; pings are answered with pongs.
 */
public class SessionEndpoint {
    private static final Logger log = LoggerFactory.getLogger(SessionEndpoint.class);

    private static final String SUPPORTED_VERSION = "13";

    /** Close status for a protocol violation. */
    private static final int CLOSE_PROTOCOL_ERROR = 1002;
    /** Close status for data the endpoint does not accept. */
    private static final int CLOSE_UNSUPPORTED_DATA = 1003;
    /** Close status for a message that is too big. */
    private static final int CLOSE_TOO_BIG = 1009;

    private final SessionManager manager;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int maxMessageSize;

    /**
     * @param manager        Shared session registry.
     * @param mapper         JSON mapper for protocol messages.
     * @param clock          Time source for message timestamps.
     * @param maxMessageSize Largest accepted message, after reassembly.
     */
    public SessionEndpoint(SessionManager manager, ObjectMapper mapper, Clock clock, int maxMessageSize) {
        this.manager = manager;
        this.mapper = mapper;
        this.clock = clock;
        this.maxMessageSize = maxMessageSize;
    }

    /**
     * Completes the handshake and serves the connection until it closes.
     *
     * @param headers    Request headers of the upgrade request.
     * @param in         Client input, positioned after the request head.
     * @param out        Client output.
     * @param remoteAddr Client address for logging.
     * @return The status written in answer to the upgrade request.
     * @throws IOException if the handshake cannot be written.
     */
    public int serve(Map<String, String> headers, InputStream in, OutputStream out, String remoteAddr)
            throws IOException {
        String key = headers.get(HeaderConstants.SEC_WEBSOCKET_KEY.getValue());
        if (key == null || key.isBlank()) {
            writeRejection(out, 400, "Bad Request");
            return 400;
        }
        if (!SUPPORTED_VERSION.equals(headers.get(HeaderConstants.SEC_WEBSOCKET_VERSION.getValue()))) {
            writeRejection(out, 426, "Upgrade Required");
            return 426;
        }

        Map<String, String> response = new LinkedHashMap<>();
        response.put(HeaderConstants.UPGRADE.getValue(), "websocket");
        response.put(HeaderConstants.CONNECTION.getValue(), "Upgrade");
        response.put(HeaderConstants.SEC_WEBSOCKET_ACCEPT.getValue(), WebSocketFrameCodec.acceptKey(key));
        IoUtils.writeHead(out, "HTTP/1.1 101 Switching Protocols", response);

        WebSocketSessionMember member = new WebSocketSessionMember(UUID.randomUUID().toString(), out);
        SessionProtocolHandler handler = new SessionProtocolHandler(manager, mapper, clock, member);
        log.debug("Session connection {} opened from {}", member.id(), remoteAddr);
        try {
            readLoop(in, member, handler);
        } catch (ProtocolException e) {
            log.debug("Session connection {} violated the protocol: {}", member.id(), e.getMessage());
            member.close(CLOSE_PROTOCOL_ERROR);
        } catch (IOException e) {
            log.debug("Session connection {} failed: {}", member.id(), e.getMessage());
        } finally {
            handler.onClose();
            log.debug("Session connection {} closed", member.id());
        }
        return 101;
    }

    private void readLoop(InputStream in, WebSocketSessionMember member, SessionProtocolHandler handler)
            throws IOException {
        ByteArrayOutputStream message = null;
        WebSocketFrame frame;
        while ((frame = WebSocketFrameCodec.readFrame(in, maxMessageSize)) != null) {
            switch (frame.opcode()) {
                case WebSocketFrameCodec.OPCODE_PING -> member.sendFrame(WebSocketFrameCodec.OPCODE_PONG,
                        frame.payload());
                case WebSocketFrameCodec.OPCODE_PONG -> {
                    // unsolicited pongs are ignored
                }
                case WebSocketFrameCodec.OPCODE_CLOSE -> {
                    member.sendFrame(WebSocketFrameCodec.OPCODE_CLOSE, frame.payload());
                    return;
                }
                case WebSocketFrameCodec.OPCODE_TEXT -> {
                    if (message != null) {
                        throw new ProtocolException("New message started before the previous one finished");
                    }
                    if (frame.fin()) {
                        handler.onMessage(frame.text());
                    } else {
                        message = new ByteArrayOutputStream();
                        message.write(frame.payload());
                    }
                }
                case WebSocketFrameCodec.OPCODE_CONTINUATION -> {
                    if (message == null) {
                        throw new ProtocolException("Continuation frame without a message");
                    }
                    if (message.size() + frame.payload().length > maxMessageSize) {
                        member.close(CLOSE_TOO_BIG);
                        return;
                    }
                    message.write(frame.payload());
                    if (frame.fin()) {
                        handler.onMessage(message.toString(StandardCharsets.UTF_8));
                        message = null;
                    }
                }
                case WebSocketFrameCodec.OPCODE_BINARY -> {
                    member.close(CLOSE_UNSUPPORTED_DATA);
                    return;
                }
                default -> throw new ProtocolException("Unknown opcode " + frame.opcode());
            }
        }
    }

    private static void writeRejection(OutputStream out, int status, String reason) throws IOException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HeaderConstants.CONTENT_LENGTH.getValue(), "0");
        headers.put(HeaderConstants.CONNECTION.getValue(), "close");
        if (status == 426) {
            headers.put(HeaderConstants.SEC_WEBSOCKET_VERSION.getValue(), SUPPORTED_VERSION);
        }
        IoUtils.writeHead(out, "HTTP/1.1 " + status + " " + reason, headers);
    }

    /**
     * Member backed by one WebSocket connection. Writes are serialized because
     * broadcasts from other connections may target it concurrently.
     */
    static final class WebSocketSessionMember implements SessionMember {
        private final String id;
        private final OutputStream out;

        WebSocketSessionMember(String id, OutputStream out) {
            this.id = id;
            this.out = out;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void send(String message) throws IOException {
            sendFrame(WebSocketFrameCodec.OPCODE_TEXT, message.getBytes(StandardCharsets.UTF_8));
        }

        synchronized void sendFrame(int opcode, byte[] payload) throws IOException {
            WebSocketFrameCodec.writeFrame(out, opcode, payload);
        }

        void close(int status) {
            byte[] payload = { (byte) (status >>> 8), (byte) status };
            try {
                sendFrame(WebSocketFrameCodec.OPCODE_CLOSE, payload);
            } catch (IOException e) {
                log.debug("Unable to send close frame to {}: {}", id, e.getMessage());
            }
        }
    }
}
