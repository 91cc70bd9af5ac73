package com.blissfly.proxy.core.exceptions;

/**
 * A redirect pointed back to a URL already visited during the same fetch.
 */
public class CircularRedirectException extends UpstreamException {
    private final String url;

    public CircularRedirectException(String url) {
        super("Circular redirect detected at " + url, false);
        this.url = url;
    }

    /**
     * @return the URL that was visited twice.
     */
    public String getUrl() {
        return url;
    }
}
