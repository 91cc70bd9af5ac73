package com.blissfly.proxy.core.fetch;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.blissfly.proxy.core.constants.HeaderConstants;

/**
 * Browser-like request header template sent with every outbound fetch, so target sites
 * serve the same markup a desktop browser would get.
 */
public final class BrowserHeaders {

    /** User agent announced to target sites. */
    public static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private static final Map<String, String> TEMPLATE;

    static {
        Map<String, String> t = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        t.put("User-Agent", USER_AGENT);
        t.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,"
                + "image/webp,image/apng,*/*;q=0.8");
        t.put("Accept-Language", "en-US,en;q=0.9");
        t.put("Accept-Encoding", "gzip, deflate, br");
        t.put("Upgrade-Insecure-Requests", "1");
        t.put("Sec-Fetch-Dest", "document");
        t.put("Sec-Fetch-Mode", "navigate");
        t.put("Sec-Fetch-Site", "none");
        t.put("Sec-Fetch-User", "?1");
        TEMPLATE = Collections.unmodifiableMap(t);
    }

    private BrowserHeaders() {
        // Utility class
    }

    /**
     * Builds the header set for a request to the given target.
     *
     * @param target    Target URL; its origin becomes {@code Origin} and {@code Referer}.
     * @param overrides Headers replacing or extending the template, may be empty.
     * @return A case-insensitive, mutable header map.
     */
    public static Map<String, String> forTarget(URI target, Map<String, String> overrides) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(TEMPLATE);
        String origin = originOf(target);
        headers.put(HeaderConstants.ORIGIN.getValue(), origin);
        headers.put(HeaderConstants.REFERER.getValue(), origin + "/");
        headers.putAll(overrides);
        return headers;
    }

    /**
     * @param uri An absolute URI.
     * @return {@code scheme://host[:port]}.
     */
    public static String originOf(URI uri) {
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getHost());
        if (uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }
        return sb.toString();
    }
}
