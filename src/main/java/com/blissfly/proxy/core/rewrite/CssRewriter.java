package com.blissfly.proxy.core.rewrite;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.blissfly.proxy.core.exceptions.RewriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites resource references inside stylesheets.
 * <p>
 * This is a pattern-based pass, not a CSS parser: it handles {@code url(...)} in its
 * quoted and unquoted forms and the string form of {@code @import}. Occurrences that
 * cannot be resolved are left untouched.
 */
public class CssRewriter {
    private static final Logger log = LoggerFactory.getLogger(CssRewriter.class);

    private static final Pattern URL_PATTERN = Pattern.compile(
            "url\\(\\s*(?:\"([^\"]*)\"|'([^']*)'|([^)'\"\\s]*))\\s*\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "@import\\s+(?:\"([^\"]*)\"|'([^']*)')", Pattern.CASE_INSENSITIVE);

    /**
     * Rewrites a stylesheet or inline style declaration.
     *
     * @param css     Stylesheet text.
     * @param context Rewrite context of the owning document.
     * @return The rewritten text.
     */
    public String rewrite(String css, RewriteContext context) {
        if (css == null || css.isEmpty()) {
            return css;
        }
        String withImports = replace(IMPORT_PATTERN, css, context, true);
        return replace(URL_PATTERN, withImports, context, false);
    }

    private String replace(Pattern pattern, String css, RewriteContext context, boolean importForm) {
        Matcher m = pattern.matcher(css);
        StringBuilder sb = new StringBuilder(css.length() + 64);
        while (m.find()) {
            String value = firstGroup(m);
            String replacement = m.group();
            if (!RewriteContext.isNonRewritable(value)) {
                try {
                    String proxied = context.rewrite(value);
                    replacement = importForm ? "@import \"" + proxied + "\"" : "url(\"" + proxied + "\")";
                } catch (RewriteException e) {
                    log.debug("Leaving CSS reference unchanged: {}", e.getMessage());
                }
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String firstGroup(Matcher m) {
        for (int i = 1; i <= m.groupCount(); i++) {
            if (m.group(i) != null) {
                return m.group(i);
            }
        }
        return "";
    }
}
