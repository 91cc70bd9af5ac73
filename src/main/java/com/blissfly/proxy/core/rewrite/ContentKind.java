package com.blissfly.proxy.core.rewrite;

import java.util.Locale;

/**
 * Broad category of a response body, derived from its declared content type.
 */
public enum ContentKind {
    HTML,
    CSS,
    SCRIPT,
    OTHER;

    /**
     * Classifies a Content-Type header value.
     *
     * @param contentType The header value, parameters allowed; may be null.
     * @return The matching kind; {@link #OTHER} when unknown.
     */
    public static ContentKind of(String contentType) {
        if (contentType == null) {
            return OTHER;
        }
        String mime = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return switch (mime) {
            case "text/html", "application/xhtml+xml" -> HTML;
            case "text/css" -> CSS;
            case "application/javascript", "text/javascript", "application/x-javascript",
                    "application/ecmascript", "text/ecmascript" -> SCRIPT;
            default -> OTHER;
        };
    }
}
