package com.blissfly.proxy.core.codec;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.blissfly.proxy.core.exceptions.InvalidTokenException;

/**
 * Turns absolute target URLs into opaque path-safe tokens and back.
 * <p>
 * A token is the unpadded base64url form of the URL's UTF-8 bytes, so it only ever
 * contains {@code [A-Za-z0-9_-]} and can be placed in a path segment or query value
 * without escaping. Decoding is strict: only the canonical encoding of a well-formed
 * absolute URL is accepted, which keeps the mapping bijective.
 */
public class UrlCodec {

    /** Path serving proxied documents. */
    public static final String WATCH_PATH = "/watch";

    /** Query parameter carrying the token on {@link #WATCH_PATH}. */
    public static final String URL_PARAM = "url";

    /** Path prefix for WebSocket tunnels; the token follows it. */
    public static final String TUNNEL_PREFIX = "/tunnel/";

    private static final Pattern TOKEN_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Set<String> HTTP_SCHEMES = Set.of("http", "https");
    private static final Set<String> TUNNEL_SCHEMES = Set.of("http", "https", "ws", "wss");

    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
    private final Base64.Decoder decoder = Base64.getUrlDecoder();

    /**
     * Encodes an absolute URL into a token.
     *
     * @param url The absolute URL.
     * @return The path-safe token.
     */
    public String encode(String url) {
        if (url == null) {
            throw new IllegalArgumentException("url must not be null");
        }
        return encoder.encodeToString(url.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes a token back into the absolute http(s) URL it was produced from.
     *
     * @param token The token.
     * @return The original URL.
     * @throws InvalidTokenException if the token is blank, malformed or does not denote an
     *                               absolute http(s) URL.
     */
    public String decode(String token) {
        return decode(token, HTTP_SCHEMES);
    }

    /**
     * Decodes a tunnel token. Accepts ws and wss targets in addition to http(s).
     *
     * @param token The token taken from {@code /tunnel/<token>}.
     * @return The original target URL.
     */
    public String decodeTunnelTarget(String token) {
        return decode(token, TUNNEL_SCHEMES);
    }

    /**
     * Builds the proxy path serving the given URL.
     *
     * @param url The absolute target URL.
     * @return {@code /watch?url=<token>}.
     */
    public String proxyPath(String url) {
        return WATCH_PATH + "?" + URL_PARAM + "=" + encode(url);
    }

    /**
     * Builds the proxy path tunnelling a WebSocket to the given URL.
     *
     * @param url The ws(s) or http(s) target.
     * @return {@code /tunnel/<token>}.
     */
    public String tunnelPath(String url) {
        return TUNNEL_PREFIX + encode(url);
    }

    /**
     * Normalizes user input into an absolute URL. A value without a scheme is treated as a
     * host name and defaulted to https.
     *
     * @param input Raw user input, e.g. {@code example.com/page}.
     * @return The absolute URL.
     * @throws InvalidTokenException if the input is blank or cannot form an http(s) URL.
     */
    public static String normalizeTarget(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidTokenException("Target URL is empty");
        }
        String trimmed = input.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        String candidate = lower.startsWith("http://") || lower.startsWith("https://")
                ? trimmed
                : "https://" + trimmed;
        validate(candidate, HTTP_SCHEMES);
        return candidate;
    }

    /**
     * Checks whether a string is a well-formed absolute http(s) URL.
     *
     * @param url The candidate.
     * @return true if it could be encoded and decoded by this codec.
     */
    public static boolean isProxyTarget(String url) {
        try {
            validate(url, HTTP_SCHEMES);
            return true;
        } catch (InvalidTokenException e) {
            return false;
        }
    }

    private String decode(String token, Set<String> schemes) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }
        if (!TOKEN_PATTERN.matcher(token).matches()) {
            throw new InvalidTokenException("Token contains characters outside the base64url alphabet");
        }

        byte[] bytes;
        try {
            bytes = decoder.decode(token);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Token is not valid base64url", e);
        }
        if (!encoder.encodeToString(bytes).equals(token)) {
            throw new InvalidTokenException("Token is not in canonical form");
        }

        String url;
        try {
            url = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidTokenException("Token does not contain UTF-8 text", e);
        }

        validate(url, schemes);
        return url;
    }

    private static void validate(String url, Set<String> schemes) {
        if (url == null || url.isBlank()) {
            throw new InvalidTokenException("URL is empty");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new InvalidTokenException("Malformed URL: " + e.getMessage(), e);
        }
        if (!uri.isAbsolute() || uri.isOpaque()) {
            throw new InvalidTokenException("URL is not absolute: " + url);
        }
        if (!schemes.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            throw new InvalidTokenException("Unsupported scheme: " + uri.getScheme());
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new InvalidTokenException("URL has no host: " + url);
        }
    }
}
