package com.blissfly.proxy.core.rewrite;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.blissfly.proxy.core.codec.UrlCodec;
import com.blissfly.proxy.core.exceptions.RewriteException;
import com.blissfly.proxy.core.fetch.BrowserHeaders;
import org.jsoup.internal.StringUtil;

/**
 * Immutable state shared by the rewriters while one document is transformed.
 * <p>
 * {@code documentUrl} is the final URL of the fetched resource. {@code baseUrl} starts
 * equal to it and is replaced when the document declares a {@code <base href>}.
 * {@code proxyOrigin} is the proxy's public origin as the browser sees it; when known,
 * rewritten references are absolute on that origin, otherwise they are origin-relative
 * paths.
 */
public final class RewriteContext {

    private static final List<String> NON_REWRITABLE_PREFIXES = List.of(
            "data:", "javascript:", "#", "mailto:", "tel:", "blob:", "about:");

    /** Printable ASCII characters browsers send percent-encoded. */
    private static final String ILLEGAL_CHARACTERS = " \"<>\\^`{|}";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private static final Pattern LEADING_DOT_SEGMENTS = Pattern.compile("^/(?:\\.\\.?/)+");

    private final URI documentUrl;
    private final URI baseUrl;
    private final String proxyOrigin;
    private final UrlCodec codec;

    /**
     * @param documentUrl Final URL of the document being rewritten.
     * @param proxyOrigin Public origin of the proxy, e.g. {@code https://proxy.example}; may be null.
     * @param codec       Codec producing proxy paths.
     */
    public RewriteContext(String documentUrl, String proxyOrigin, UrlCodec codec) {
        this(parse(documentUrl), null, proxyOrigin, codec);
    }

    private RewriteContext(URI documentUrl, URI baseUrl, String proxyOrigin, UrlCodec codec) {
        this.documentUrl = withRootPath(documentUrl);
        this.baseUrl = baseUrl != null ? withRootPath(baseUrl) : this.documentUrl;
        this.proxyOrigin = trimTrailingSlash(proxyOrigin);
        this.codec = codec;
    }

    /**
     * Returns a copy whose references resolve against a different base.
     *
     * @param newBase Absolute base URL.
     * @return The derived context.
     */
    public RewriteContext withBase(URI newBase) {
        return new RewriteContext(documentUrl, newBase, proxyOrigin, codec);
    }

    public URI getDocumentUrl() {
        return documentUrl;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    /**
     * @return Origin of the target document, {@code scheme://host[:port]}.
     */
    public String getOrigin() {
        return BrowserHeaders.originOf(documentUrl);
    }

    /**
     * @return The proxy's public origin without trailing slash, or null if unknown.
     */
    public String getProxyOrigin() {
        return proxyOrigin;
    }

    /**
     * Tells whether a reference must be left as it is (fragments, inline data, script
     * pseudo-URLs and similar).
     *
     * @param value Attribute value or CSS URL.
     * @return true if the value is not a fetchable reference.
     */
    public static boolean isNonRewritable(String value) {
        if (value == null) {
            return true;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String prefix : NON_REWRITABLE_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves a reference against the current base the way a browser does: characters a
     * browser tolerates (spaces, {@code |}, braces, non-ASCII) are percent-encoded and dot
     * segments climbing above the root are dropped.
     *
     * @param reference Relative or absolute reference.
     * @return The absolute http(s) URL.
     * @throws RewriteException if the reference is malformed or not http(s).
     */
    public String resolve(String reference) {
        String ref = reference.trim();
        String joined = StringUtil.resolve(baseUrl.toString(), ref);
        if (joined.isEmpty()) {
            throw new RewriteException("Cannot resolve reference '" + ref + "'");
        }
        URI resolved;
        try {
            resolved = new URI(escapeIllegal(joined)).normalize();
        } catch (URISyntaxException e) {
            throw new RewriteException("Cannot resolve reference '" + ref + "'", e);
        }
        String scheme = resolved.getScheme();
        if (scheme == null || resolved.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new RewriteException("Reference does not denote an http(s) resource: " + ref);
        }
        return withoutLeadingDotSegments(resolved);
    }

    /**
     * Resolves a reference and wraps it into a proxy URL.
     *
     * @param reference Relative or absolute reference.
     * @return Proxy URL for the resolved target.
     * @throws RewriteException if the reference cannot be resolved.
     */
    public String rewrite(String reference) {
        return proxyUrl(resolve(reference));
    }

    /**
     * Wraps an absolute URL into a proxy URL.
     *
     * @param absoluteUrl Absolute http(s) URL.
     * @return {@code [proxyOrigin]/watch?url=<token>}.
     */
    public String proxyUrl(String absoluteUrl) {
        String path = codec.proxyPath(absoluteUrl);
        return proxyOrigin != null ? proxyOrigin + path : path;
    }

    /**
     * Percent-encodes bytes that may not appear in a URI. A {@code %} not followed by two
     * hex digits is encoded as well.
     */
    static String escapeIllegal(String url) {
        byte[] bytes = url.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            int c = bytes[i] & 0xFF;
            boolean legal = c > 0x20 && c < 0x7F && ILLEGAL_CHARACTERS.indexOf(c) < 0;
            if (c == '%') {
                legal = i + 2 < bytes.length && isHex(bytes[i + 1]) && isHex(bytes[i + 2]);
            }
            if (legal) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(byte b) {
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
    }

    private static String withoutLeadingDotSegments(URI uri) {
        String path = uri.getRawPath();
        if (path == null || !path.startsWith("/..") && !path.startsWith("/./")) {
            return uri.toString();
        }
        String fixed = LEADING_DOT_SEGMENTS.matcher(path).replaceFirst("/");
        if ("/..".equals(fixed) || "/.".equals(fixed)) {
            fixed = "/";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getRawAuthority()).append(fixed);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        if (uri.getRawFragment() != null) {
            sb.append('#').append(uri.getRawFragment());
        }
        return sb.toString();
    }

    private static URI parse(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new RewriteException("Invalid document URL: " + url, e);
        }
    }

    private static URI withRootPath(URI uri) {
        if (uri.getRawPath() != null && !uri.getRawPath().isEmpty()) {
            return uri;
        }
        if (uri.isOpaque() || uri.getRawAuthority() == null) {
            return uri;
        }
        String prefix = uri.getScheme() + "://" + uri.getRawAuthority();
        String text = uri.toString();
        return text.startsWith(prefix) ? URI.create(prefix + "/" + text.substring(prefix.length())) : uri;
    }

    private static String trimTrailingSlash(String origin) {
        if (origin == null || origin.isBlank()) {
            return null;
        }
        return origin.endsWith("/") ? origin.substring(0, origin.length() - 1) : origin;
    }
}
