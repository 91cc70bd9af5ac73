package com.blissfly.proxy.core.fetch;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

import com.blissfly.proxy.core.exceptions.MalformedUpstreamResponseException;
import org.brotli.dec.BrotliInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undoes HTTP content codings so the rewriters always see plain bytes.
 * <p>
 * Supports identity, gzip, x-gzip, deflate (zlib-wrapped or raw) and br. Codings listed
 * together in one header are undone in reverse order of application. Unknown codings are
 * left in place and the body is passed through untouched from that point on.
 */
public final class ContentDecoder {
    private static final Logger log = LoggerFactory.getLogger(ContentDecoder.class);

    private ContentDecoder() {
        // Utility class
    }

    /**
     * Decodes a response body.
     *
     * @param body            Raw body bytes as received.
     * @param contentEncoding Value of the Content-Encoding header, may be null.
     * @return The decoded body.
     * @throws MalformedUpstreamResponseException if a known coding fails to decode.
     */
    public static byte[] decode(byte[] body, String contentEncoding) {
        if (body == null || body.length == 0 || contentEncoding == null || contentEncoding.isBlank()) {
            return body;
        }

        List<String> codings = new ArrayList<>();
        for (String part : contentEncoding.split(",")) {
            String coding = part.trim().toLowerCase(Locale.ROOT);
            if (!coding.isEmpty()) {
                codings.add(coding);
            }
        }

        byte[] current = body;
        for (int i = codings.size() - 1; i >= 0; i--) {
            String coding = codings.get(i);
            switch (coding) {
                case "identity" -> {
                    // nothing to undo
                }
                case "gzip", "x-gzip" -> current = gunzip(current);
                case "deflate" -> current = inflate(current);
                case "br" -> current = unbrotli(current);
                default -> {
                    log.debug("Unknown content coding '{}', passing body through", coding);
                    return current;
                }
            }
        }
        return current;
    }

    /**
     * @param contentEncoding Value of the Content-Encoding header, may be null.
     * @return true if every listed coding is one this decoder can undo.
     */
    public static boolean isSupported(String contentEncoding) {
        if (contentEncoding == null || contentEncoding.isBlank()) {
            return true;
        }
        for (String part : contentEncoding.split(",")) {
            String coding = part.trim().toLowerCase(Locale.ROOT);
            if (!coding.isEmpty() && !List.of("identity", "gzip", "x-gzip", "deflate", "br").contains(coding)) {
                return false;
            }
        }
        return true;
    }

    private static byte[] gunzip(byte[] data) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new MalformedUpstreamResponseException("Corrupt gzip body: " + e.getMessage(), e);
        }
    }

    private static byte[] inflate(byte[] data) {
        try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (ZipException e) {
            // Some servers send raw deflate without the zlib wrapper.
            return inflateRaw(data);
        } catch (IOException e) {
            throw new MalformedUpstreamResponseException("Corrupt deflate body: " + e.getMessage(), e);
        }
    }

    private static byte[] inflateRaw(byte[] data) {
        Inflater inflater = new Inflater(true);
        try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(data), inflater)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new MalformedUpstreamResponseException("Corrupt deflate body: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    private static byte[] unbrotli(byte[] data) {
        try (InputStream in = new BrotliInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new MalformedUpstreamResponseException("Corrupt brotli body: " + e.getMessage(), e);
        }
    }
}
