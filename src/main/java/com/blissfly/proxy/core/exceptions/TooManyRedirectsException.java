package com.blissfly.proxy.core.exceptions;

/**
 * The redirect chain grew past the configured hop limit.
 */
public class TooManyRedirectsException extends UpstreamException {
    public TooManyRedirectsException(int maxRedirects) {
        super("Too many redirects (limit " + maxRedirects + ")", false);
    }
}
