package com.blissfly.proxy.core.session;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import com.blissfly.proxy.core.exceptions.ProtocolException;

/**
 * Minimal RFC 6455 framing for the server side of a WebSocket connection.
 * <p>
 * Reads masked client frames and writes unmasked server frames. Extensions are not
 * negotiated, so the reserved bits must be zero.
 */
public final class WebSocketFrameCodec {

    /** Handshake GUID from RFC 6455 section 1.3. */
    public static final String GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

    public static final int OPCODE_CONTINUATION = 0x0;
    public static final int OPCODE_TEXT = 0x1;
    public static final int OPCODE_BINARY = 0x2;
    public static final int OPCODE_CLOSE = 0x8;
    public static final int OPCODE_PING = 0x9;
    public static final int OPCODE_PONG = 0xA;

    private WebSocketFrameCodec() {
        // Utility class
    }

    /**
     * Computes the {@code Sec-WebSocket-Accept} answer for a client key.
     *
     * @param key The client's {@code Sec-WebSocket-Key}.
     * @return Base64 of SHA-1 over key and GUID.
     */
    public static String acceptKey(String key) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] digest = sha1.digest((key.trim() + GUID).getBytes(StandardCharsets.US_ASCII));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /**
     * Reads one client frame.
     *
     * @param in         Client input stream.
     * @param maxPayload Largest accepted payload length.
     * @return The frame, or null on a clean end of stream before the first byte.
     * @throws IOException       on I/O failure or truncated frame.
     * @throws ProtocolException if the frame is unmasked, uses reserved bits or is too large.
     */
    public static WebSocketFrame readFrame(InputStream in, int maxPayload) throws IOException {
        int b0 = in.read();
        if (b0 == -1) {
            return null;
        }
        int b1 = readByte(in);

        boolean fin = (b0 & 0x80) != 0;
        if ((b0 & 0x70) != 0) {
            throw new ProtocolException("Reserved bits set in WebSocket frame");
        }
        int opcode = b0 & 0x0F;
        boolean masked = (b1 & 0x80) != 0;
        if (!masked) {
            throw new ProtocolException("Client frame is not masked");
        }

        long length = b1 & 0x7F;
        if (length == 126) {
            length = ((long) readByte(in) << 8) | readByte(in);
        } else if (length == 127) {
            length = 0;
            for (int i = 0; i < 8; i++) {
                length = (length << 8) | readByte(in);
            }
        }
        if (length < 0 || length > maxPayload) {
            throw new ProtocolException("WebSocket frame payload too large: " + length);
        }
        if ((opcode & 0x08) != 0 && (length > 125 || !fin)) {
            throw new ProtocolException("Invalid WebSocket control frame");
        }

        byte[] mask = readFully(in, 4);
        byte[] payload = readFully(in, (int) length);
        for (int i = 0; i < payload.length; i++) {
            payload[i] ^= mask[i & 3];
        }
        return new WebSocketFrame(fin, opcode, payload);
    }

    /**
     * Writes one unmasked, final server frame and flushes.
     *
     * @param out     Client output stream.
     * @param opcode  Frame opcode.
     * @param payload Payload bytes.
     * @throws IOException on write failure.
     */
    public static void writeFrame(OutputStream out, int opcode, byte[] payload) throws IOException {
        int length = payload.length;
        out.write(0x80 | (opcode & 0x0F));
        if (length < 126) {
            out.write(length);
        } else if (length <= 0xFFFF) {
            out.write(126);
            out.write((length >>> 8) & 0xFF);
            out.write(length & 0xFF);
        } else {
            out.write(127);
            for (int shift = 56; shift >= 0; shift -= 8) {
                out.write((int) (((long) length >>> shift) & 0xFF));
            }
        }
        out.write(payload);
        out.flush();
    }

    /**
     * Writes a text frame.
     *
     * @param out  Client output stream.
     * @param text Message text.
     * @throws IOException on write failure.
     */
    public static void writeText(OutputStream out, String text) throws IOException {
        writeFrame(out, OPCODE_TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    private static int readByte(InputStream in) throws IOException {
        int b = in.read();
        if (b == -1) {
            throw new EOFException("Truncated WebSocket frame");
        }
        return b;
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] data = in.readNBytes(length);
        if (data.length != length) {
            throw new EOFException("Truncated WebSocket frame");
        }
        return data;
    }
}
