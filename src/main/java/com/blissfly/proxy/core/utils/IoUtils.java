package com.blissfly.proxy.core.utils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import com.blissfly.proxy.core.exceptions.ProtocolException;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream helpers shared by the inbound server, the session endpoint and the tunnel.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Buffer size used for relay transfers. */
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    /** Largest accepted request line or header line. */
    public static final int MAX_LINE_LENGTH = 8192;

    /** Largest accepted number of header lines in one message head. */
    public static final int MAX_HEADERS = 100;

    /**
     * Pumps bytes in both directions until either side reaches end of stream or fails.
     * The direction 1 to 2 runs on the executor, the direction 2 to 1 on the calling
     * thread. When a direction ends, the streams it used are closed, which in turn ends
     * the other direction.
     *
     * @param in1           Input from side 1.
     * @param out1          Output to side 1.
     * @param in2           Input from side 2.
     * @param out2          Output to side 2.
     * @param executor      Executor for the forward direction.
     * @param bytesSent     Optional counter for bytes moved from side 1 to side 2.
     * @param bytesReceived Optional counter for bytes moved from side 2 to side 1.
     */
    public static void relay(InputStream in1, OutputStream out1, InputStream in2, OutputStream out2,
            Executor executor, Counter bytesSent, Counter bytesReceived) {

        CompletableFuture<Void> forward = CompletableFuture.runAsync(() -> {
            try {
                transferWithCounting(in1, out2, bytesSent);
            } catch (IOException e) {
                log.debug("Relay forward error: {}", e.getMessage());
            } finally {
                closeQuietly(in1);
                closeQuietly(out2);
            }
        }, executor);

        try {
            transferWithCounting(in2, out1, bytesReceived);
        } catch (IOException e) {
            log.debug("Relay backward error: {}", e.getMessage());
        } finally {
            closeQuietly(in2);
            closeQuietly(out1);
        }

        try {
            forward.join();
        } catch (Exception e) {
            log.debug("Bidirectional relay joined with exception: {}", e.getMessage());
        }
    }

    private static void transferWithCounting(InputStream in, OutputStream out, Counter counter) throws IOException {
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) >= 0) {
            out.write(buffer, 0, read);
            out.flush();
            if (counter != null) {
                counter.increment(read);
            }
        }
    }

    /**
     * Reads one CRLF or LF terminated line, limited to {@link #MAX_LINE_LENGTH}.
     *
     * @param in The input stream to read from.
     * @return The line without terminator, or null at end of stream.
     * @throws IOException If an I/O error occurs or the line is too long.
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, MAX_LINE_LENGTH);
    }

    /**
     * Reads one CRLF or LF terminated line as ISO-8859-1.
     *
     * @param in        The input stream to read from.
     * @param maxLength The maximum allowed length of the line.
     * @return The line without terminator, or null at end of stream.
     * @throws IOException If an I/O error occurs or the line exceeds maxLength.
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int len = 0;
        int c;
        while ((c = in.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (c != '\r') {
                if (++len > maxLength) {
                    throw new ProtocolException("Line length exceeds maximum allowed length of " + maxLength);
                }
                buf.write(c);
            }
        }
        if (c == -1 && len == 0) {
            return null;
        }
        return buf.toString(StandardCharsets.ISO_8859_1);
    }

    /**
     * Reads header lines up to the empty line ending a message head. Repeated names keep
     * the last value.
     *
     * @param in The input stream positioned after the start line.
     * @return Case-insensitive map of header names to values.
     * @throws IOException       If an I/O error occurs.
     * @throws ProtocolException If more than {@link #MAX_HEADERS} lines are sent.
     */
    public static Map<String, String> readHeaders(InputStream in) throws IOException {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        String line;
        int headerCount = 0;
        while ((line = readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HEADERS) {
                throw new ProtocolException("Too many HTTP headers (exceeds limit of " + MAX_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.put(line.substring(0, idx).trim(), line.substring(idx + 1).trim());
            }
        }
        return headers;
    }

    /**
     * Writes a message head (start line, headers, blank line) in ISO-8859-1.
     *
     * @param out       Destination stream.
     * @param startLine Status or request line without terminator.
     * @param headers   Header fields to write, in iteration order.
     * @throws IOException If an I/O error occurs.
     */
    public static void writeHead(OutputStream out, String startLine, Map<String, String> headers)
            throws IOException {
        StringBuilder sb = new StringBuilder(256);
        sb.append(startLine).append("\r\n");
        headers.forEach((k, v) -> sb.append(k).append(": ").append(v).append("\r\n"));
        sb.append("\r\n");
        out.write(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
    }

    /**
     * Safely closes a resource without throwing exceptions.
     *
     * @param closeable The resource to close.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Safely closes a resource, logging any exceptions.
     *
     * @param closeable The resource to close.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
