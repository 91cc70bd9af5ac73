package com.blissfly.proxy.core.rewrite;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.blissfly.proxy.core.exceptions.RewriteException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree-based HTML rewriter.
 * <p>
 * Parses the document with jsoup, rewrites every fetchable reference so it points at the
 * proxy, passes inline styles and scripts through the CSS and script rewriters, pins an
 * existing {@code <base>} to its absolute original URL and injects the client runtime as
 * the first child of {@code <head>}. A reference that cannot be rewritten is left as it
 * was; the rest of the document is still processed.
 */
public class HtmlRewriter {
    private static final Logger log = LoggerFactory.getLogger(HtmlRewriter.class);

    /** Attributes holding a single URL. */
    private static final Set<String> URL_ATTRIBUTES = Set.of("src", "href", "action", "data", "poster",
            "formaction");

    /** Attributes holding a comma-separated list of image candidates. */
    private static final Set<String> SRCSET_ATTRIBUTES = Set.of("srcset", "imagesrcset");

    private static final Set<String> SCRIPT_TYPES = Set.of("", "text/javascript", "application/javascript",
            "module", "application/ecmascript", "text/ecmascript", "application/x-javascript");

    private static final Pattern META_REFRESH = Pattern.compile("^(\\s*\\d+\\s*[;,]\\s*url\\s*=\\s*)(['\"]?)(.*?)\\2\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /** Marks the injected runtime element. */
    public static final String RUNTIME_ATTRIBUTE = "data-blissfly-runtime";

    private final CssRewriter cssRewriter;
    private final ScriptRewriter scriptRewriter;
    private final ClientRuntimeShim shim;

    /**
     * @param cssRewriter    Rewriter for style attributes and style elements.
     * @param scriptRewriter Rewriter for inline scripts.
     * @param shim           Runtime to inject; null disables injection.
     */
    public HtmlRewriter(CssRewriter cssRewriter, ScriptRewriter scriptRewriter, ClientRuntimeShim shim) {
        this.cssRewriter = cssRewriter;
        this.scriptRewriter = scriptRewriter;
        this.shim = shim;
    }

    /**
     * Rewrites an HTML document.
     *
     * @param html    Document source.
     * @param context Rewrite context of the document URL.
     * @return The serialized, rewritten document.
     */
    public String rewrite(String html, RewriteContext context) {
        Document doc = Jsoup.parse(html, context.getDocumentUrl().toString());
        doc.outputSettings().prettyPrint(false);
        doc.charset(StandardCharsets.UTF_8);

        RewriteContext effective = applyBase(doc, context);

        for (Element element : doc.getAllElements()) {
            if ("base".equals(element.normalName())) {
                continue;
            }
            rewriteAttributes(element, effective);
            switch (element.normalName()) {
                case "style" -> rewriteStyleElement(element, effective);
                case "script" -> rewriteScriptElement(element, effective);
                case "meta" -> rewriteMetaRefresh(element, effective);
                default -> {
                    // attributes only
                }
            }
        }

        if (shim != null) {
            Element runtime = doc.head().prependElement("script");
            runtime.attr(RUNTIME_ATTRIBUTE, "");
            runtime.appendChild(new DataNode(shim.render(effective)));
        }
        return doc.outerHtml();
    }

    /**
     * Resolves the first {@code <base href>} against the document URL, rewrites it to
     * the absolute original URL and returns a context resolving against it.
     */
    private RewriteContext applyBase(Document doc, RewriteContext context) {
        Element base = doc.selectFirst("base[href]");
        if (base == null) {
            return context;
        }
        try {
            String absolute = context.resolve(base.attr("href"));
            base.attr("href", absolute);
            return context.withBase(URI.create(absolute));
        } catch (RewriteException | IllegalArgumentException e) {
            log.debug("Ignoring unusable <base href=\"{}\">: {}", base.attr("href"), e.getMessage());
            return context;
        }
    }

    private void rewriteAttributes(Element element, RewriteContext context) {
        List<Attribute> attributes = new ArrayList<>(element.attributes().asList());
        for (Attribute attribute : attributes) {
            String name = attribute.getKey().toLowerCase(Locale.ROOT);
            String value = attribute.getValue();
            if (URL_ATTRIBUTES.contains(name)) {
                if (!RewriteContext.isNonRewritable(value)) {
                    rewriteUrlAttribute(element, attribute.getKey(), value, context);
                }
            } else if (SRCSET_ATTRIBUTES.contains(name)) {
                element.attr(attribute.getKey(), rewriteSrcset(value, context));
            } else if ("style".equals(name) && !value.isBlank()) {
                element.attr(attribute.getKey(), cssRewriter.rewrite(value, context));
            }
        }
    }

    private void rewriteUrlAttribute(Element element, String name, String value, RewriteContext context) {
        try {
            element.attr(name, context.rewrite(value));
        } catch (RewriteException e) {
            log.debug("Leaving {}=\"{}\" on <{}> unchanged: {}", name, value, element.normalName(), e.getMessage());
        }
    }

    /**
     * Rewrites each image candidate of a srcset value, preserving its descriptor.
     * <p>
     * Candidates are split as the HTML image candidate parser does: the URL runs up to
     * whitespace, so commas inside it (as in {@code data:} URLs) belong to the URL. Only a
     * trailing comma on the URL, or a comma after the descriptors outside parentheses,
     * ends a candidate.
     *
     * @param srcset  The attribute value.
     * @param context Rewrite context.
     * @return The rewritten value.
     */
    String rewriteSrcset(String srcset, RewriteContext context) {
        if (srcset == null || srcset.isBlank()) {
            return srcset;
        }
        List<String> candidates = new ArrayList<>();
        int pos = 0;
        int length = srcset.length();
        while (pos < length) {
            while (pos < length && (Character.isWhitespace(srcset.charAt(pos)) || srcset.charAt(pos) == ',')) {
                pos++;
            }
            if (pos >= length) {
                break;
            }
            int urlStart = pos;
            while (pos < length && !Character.isWhitespace(srcset.charAt(pos))) {
                pos++;
            }
            String url = srcset.substring(urlStart, pos);
            String descriptor = "";
            if (url.endsWith(",")) {
                url = url.replaceAll(",+$", "");
            } else {
                int descriptorStart = pos;
                int depth = 0;
                while (pos < length) {
                    char c = srcset.charAt(pos);
                    if (c == '(') {
                        depth++;
                    } else if (c == ')' && depth > 0) {
                        depth--;
                    } else if (c == ',' && depth == 0) {
                        break;
                    }
                    pos++;
                }
                String trimmed = srcset.substring(descriptorStart, pos).trim();
                descriptor = trimmed.isEmpty() ? "" : " " + trimmed;
                pos++;
            }
            candidates.add(rewriteCandidate(url, context) + descriptor);
        }
        return String.join(", ", candidates);
    }

    private String rewriteCandidate(String url, RewriteContext context) {
        if (RewriteContext.isNonRewritable(url)) {
            return url;
        }
        try {
            return context.rewrite(url);
        } catch (RewriteException e) {
            log.debug("Leaving srcset candidate '{}' unchanged: {}", url, e.getMessage());
            return url;
        }
    }

    private void rewriteStyleElement(Element element, RewriteContext context) {
        for (DataNode node : element.dataNodes()) {
            node.setWholeData(cssRewriter.rewrite(node.getWholeData(), context));
        }
    }

    private void rewriteScriptElement(Element element, RewriteContext context) {
        if (element.hasAttr(RUNTIME_ATTRIBUTE)) {
            return;
        }
        String type = element.attr("type").trim().toLowerCase(Locale.ROOT);
        if (!SCRIPT_TYPES.contains(type)) {
            return;
        }
        for (DataNode node : element.dataNodes()) {
            String body = node.getWholeData();
            if (!body.isBlank()) {
                node.setWholeData(scriptRewriter.rewriteInline(body, context));
            }
        }
    }

    private void rewriteMetaRefresh(Element element, RewriteContext context) {
        if (!"refresh".equalsIgnoreCase(element.attr("http-equiv"))) {
            return;
        }
        String content = element.attr("content");
        Matcher m = META_REFRESH.matcher(content);
        if (!m.matches() || RewriteContext.isNonRewritable(m.group(3))) {
            return;
        }
        try {
            element.attr("content", m.group(1) + context.rewrite(m.group(3)));
        } catch (RewriteException e) {
            log.debug("Leaving meta refresh '{}' unchanged: {}", content, e.getMessage());
        }
    }
}
