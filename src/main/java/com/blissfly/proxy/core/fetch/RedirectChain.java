package com.blissfly.proxy.core.fetch;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.blissfly.proxy.core.cache.ResponseCache;
import com.blissfly.proxy.core.exceptions.CircularRedirectException;
import com.blissfly.proxy.core.exceptions.TooManyRedirectsException;

/**
 * Ordered, duplicate-free record of the URLs visited by one fetch.
 * Holds at most {@code maxRedirects + 1} URLs.
 */
public class RedirectChain {
    private final Set<String> visited = new LinkedHashSet<>();
    private final List<String> urls = new ArrayList<>();
    private final int maxRedirects;

    /**
     * @param initialUrl   The URL the fetch starts from.
     * @param maxRedirects Number of hops allowed after it.
     */
    public RedirectChain(String initialUrl, int maxRedirects) {
        this.maxRedirects = maxRedirects;
        visited.add(ResponseCache.normalizeKey(initialUrl));
        urls.add(initialUrl);
    }

    /**
     * Records one redirect hop.
     *
     * @param url The absolute redirect target.
     * @throws CircularRedirectException if the URL was already visited.
     * @throws TooManyRedirectsException if the hop would exceed the limit.
     */
    public void follow(String url) {
        String key = ResponseCache.normalizeKey(url);
        if (visited.contains(key)) {
            throw new CircularRedirectException(url);
        }
        if (hops() >= maxRedirects) {
            throw new TooManyRedirectsException(maxRedirects);
        }
        visited.add(key);
        urls.add(url);
    }

    /**
     * @return Number of redirects followed so far.
     */
    public int hops() {
        return urls.size() - 1;
    }

    /**
     * @return Visited URLs in order.
     */
    public List<String> urls() {
        return List.copyOf(urls);
    }
}
