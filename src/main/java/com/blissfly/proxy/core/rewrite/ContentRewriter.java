package com.blissfly.proxy.core.rewrite;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches a response body to the rewriter matching its content type.
 * <p>
 * Text bodies are decoded with their declared charset (UTF-8 when absent or unknown),
 * rewritten and re-emitted as UTF-8. Other content types pass through untouched.
 */
public class ContentRewriter {
    private static final Logger log = LoggerFactory.getLogger(ContentRewriter.class);

    private static final Pattern CHARSET_PARAM = Pattern.compile("charset\\s*=\\s*[\"']?([^;\"'\\s]+)",
            Pattern.CASE_INSENSITIVE);

    private final HtmlRewriter htmlRewriter;
    private final CssRewriter cssRewriter;
    private final ScriptRewriter scriptRewriter;

    public ContentRewriter(HtmlRewriter htmlRewriter, CssRewriter cssRewriter, ScriptRewriter scriptRewriter) {
        this.htmlRewriter = htmlRewriter;
        this.cssRewriter = cssRewriter;
        this.scriptRewriter = scriptRewriter;
    }

    /**
     * Rewrites a response body for delivery through the proxy.
     *
     * @param body        Decoded upstream body.
     * @param contentType Declared content type, may be null.
     * @param context     Rewrite context of the resource URL.
     * @return The body to send and the content type to announce.
     */
    public RewrittenContent transform(byte[] body, String contentType, RewriteContext context) {
        ContentKind kind = ContentKind.of(contentType);
        if (kind == ContentKind.OTHER || body == null) {
            return new RewrittenContent(body, contentType, false);
        }

        String text = new String(body, charsetOf(contentType));
        String rewritten;
        try {
            rewritten = switch (kind) {
                case HTML -> htmlRewriter.rewrite(text, context);
                case CSS -> cssRewriter.rewrite(text, context);
                case SCRIPT -> scriptRewriter.rewrite(text, context);
                default -> text;
            };
        } catch (RuntimeException e) {
            log.warn("Rewriting {} failed, passing it through unchanged: {}", context.getDocumentUrl(), e.getMessage());
            return new RewrittenContent(body, contentType, false);
        }

        return new RewrittenContent(rewritten.getBytes(StandardCharsets.UTF_8), withUtf8(contentType), true);
    }

    /**
     * Extracts the charset parameter of a content type.
     *
     * @param contentType The header value, may be null.
     * @return The declared charset, or UTF-8 when absent or unsupported.
     */
    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        Matcher m = CHARSET_PARAM.matcher(contentType);
        if (m.find()) {
            try {
                return Charset.forName(m.group(1));
            } catch (IllegalArgumentException e) {
                log.debug("Unsupported charset '{}', falling back to UTF-8", m.group(1));
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static String withUtf8(String contentType) {
        String mime = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return mime + "; charset=utf-8";
    }
}
